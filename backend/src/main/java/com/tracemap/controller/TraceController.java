package com.tracemap.controller;

import java.security.Principal;
import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.tracemap.dto.ApiResponse;
import com.tracemap.dto.CreateTraceRequest;
import com.tracemap.dto.RegionSummaryDto;
import com.tracemap.dto.ReportDto;
import com.tracemap.dto.ReportRequest;
import com.tracemap.model.TraceRecord;
import com.tracemap.model.Viewport;
import com.tracemap.service.RegionSummaryService;
import com.tracemap.service.ReportService;
import com.tracemap.service.TraceService;
import com.tracemap.service.ViewportFetchResult;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/v1/traces")
@Validated
public class TraceController {

    private final TraceService traceService;
    private final RegionSummaryService regionSummaryService;
    private final ReportService reportService;

    public TraceController(TraceService traceService, RegionSummaryService regionSummaryService,
                           ReportService reportService) {
        this.traceService = traceService;
        this.regionSummaryService = regionSummaryService;
        this.reportService = reportService;
    }

    @GetMapping("/viewport")
    public ResponseEntity<?> viewport(
        @RequestParam("lat") double latitude,
        @RequestParam("lng") double longitude,
        @RequestParam("latDelta") double latitudeDelta,
        @RequestParam("lngDelta") double longitudeDelta
    ) {
        ViewportFetchResult result = traceService.viewport(Viewport.of(latitude, longitude, latitudeDelta, longitudeDelta));
        return ResponseEntity.ok(ApiResponse.ok(result.getRecords(), result.size())
            .withMeta("stage", result.getStage())
            .withMeta("precision", result.getPrecision())
            .withMeta("cellsQueried", result.getCellsQueried())
            .withMeta("cellsFailed", result.getCellsFailed())
            .withMeta("degraded", result.isDegraded()));
    }

    @GetMapping("/summaries")
    public ResponseEntity<?> summaries() {
        List<RegionSummaryDto> summaries = regionSummaryService.summaries();
        return ResponseEntity.ok(ApiResponse.ok(summaries, summaries.size()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getById(@PathVariable("id") String id) {
        TraceRecord trace = traceService.getById(id);
        return ResponseEntity.ok(ApiResponse.ok(trace));
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody @Valid CreateTraceRequest request, Principal principal) {
        String uploaderId = principal != null ? principal.getName() : null;
        TraceRecord created = traceService.create(request, uploaderId);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(created));
    }

    @PostMapping("/{id}/reports")
    public ResponseEntity<?> report(@PathVariable("id") String id, @RequestBody @Valid ReportRequest request) {
        ReportDto report = reportService.submit(id, request);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ApiResponse.ok(report).withMeta("message", "Thank you for your report. We'll review it and take appropriate action."));
    }
}
