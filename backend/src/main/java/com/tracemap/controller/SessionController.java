package com.tracemap.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.tracemap.dto.ApiResponse;
import com.tracemap.dto.SessionDto;
import com.tracemap.dto.ViewportRequest;
import com.tracemap.session.MapSession;
import com.tracemap.session.MapSessionRegistry;
import com.tracemap.session.RenderSnapshot;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/v1/sessions")
public class SessionController {

    private final MapSessionRegistry registry;

    public SessionController(MapSessionRegistry registry) {
        this.registry = registry;
    }

    @PostMapping
    public ResponseEntity<?> open() {
        MapSession session = registry.create();
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(SessionDto.from(session)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> describe(@PathVariable("id") String id) {
        return ResponseEntity.ok(ApiResponse.ok(SessionDto.from(registry.get(id))));
    }

    @PutMapping("/{id}/viewport")
    public ResponseEntity<?> viewportChanged(@PathVariable("id") String id, @RequestBody @Valid ViewportRequest request) {
        registry.pushViewport(id, request.toViewport());
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/{id}/traces")
    public ResponseEntity<?> traces(@PathVariable("id") String id,
                                    @RequestParam(value = "since", defaultValue = "-1") long since) {
        RenderSnapshot snapshot = registry.latestRender(id);
        if (snapshot.getVersion() <= since) {
            return ResponseEntity.status(HttpStatus.NOT_MODIFIED).build();
        }
        return ResponseEntity.ok(ApiResponse.ok(snapshot.getRecords(), snapshot.getRecords().size())
            .withMeta("version", snapshot.getVersion())
            .withMeta("renderedAt", snapshot.getRenderedAt()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> close(@PathVariable("id") String id) {
        registry.close(id);
        return ResponseEntity.noContent().build();
    }
}
