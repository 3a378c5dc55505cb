package com.tracemap.controller;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.tracemap.config.AppProperties;
import com.tracemap.exception.ApiExceptionHandler;
import com.tracemap.exception.SessionLimitExceededException;
import com.tracemap.exception.SessionNotFoundException;
import com.tracemap.model.Viewport;
import com.tracemap.service.TraceFetchOrchestrator;
import com.tracemap.session.MapSession;
import com.tracemap.session.MapSessionRegistry;
import com.tracemap.session.RenderSnapshot;

import static com.tracemap.support.Traces.trace;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class SessionControllerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-07-18T09:00:00Z"), ZoneOffset.UTC);

    private MapSessionRegistry registry;
    private MapSession session;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        registry = mock(MapSessionRegistry.class);
        session = new MapSession("s-1", mock(TraceFetchOrchestrator.class), records -> { }, new AppProperties(), clock);
        mockMvc = MockMvcBuilders
            .standaloneSetup(new SessionController(registry))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @AfterEach
    public void tearDown() {
        session.close();
    }

    @Test
    public void openReturnsTheNewSession() throws Exception {
        when(registry.create()).thenReturn(session);

        mockMvc.perform(post("/v1/sessions"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.data.id").value("s-1"))
            .andExpect(jsonPath("$.data.cyclesIssued").value(0));
    }

    @Test
    public void openBeyondTheSessionLimitIsUnavailable() throws Exception {
        when(registry.create()).thenThrow(new SessionLimitExceededException(500));

        mockMvc.perform(post("/v1/sessions"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Too many sessions"));
    }

    @Test
    public void viewportChangeIsAccepted() throws Exception {
        mockMvc.perform(put("/v1/sessions/s-1/viewport")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"lat\": 48.8566, \"lng\": 2.3522, \"latDelta\": 0.05, \"lngDelta\": 0.05}"))
            .andExpect(status().isAccepted());

        verify(registry).pushViewport(eq("s-1"), eq(Viewport.of(48.8566, 2.3522, 0.05, 0.05)));
    }

    @Test
    public void invalidViewportChangeIsRejected() throws Exception {
        mockMvc.perform(put("/v1/sessions/s-1/viewport")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"lat\": 48.8566, \"lng\": 2.3522, \"latDelta\": -1, \"lngDelta\": 0.05}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(put("/v1/sessions/s-1/viewport")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"lat\": 48.8566, \"lng\": 2.3522}"))
            .andExpect(status().isBadRequest());

        verify(registry, never()).pushViewport(any(), any(Viewport.class));
    }

    @Test
    public void unchangedRenderIsNotModified() throws Exception {
        when(registry.latestRender("s-1")).thenReturn(new RenderSnapshot(3, List.of(), clock.instant()));

        mockMvc.perform(get("/v1/sessions/s-1/traces").param("since", "3"))
            .andExpect(status().isNotModified());
    }

    @Test
    public void newerRenderIsReturned() throws Exception {
        when(registry.latestRender("s-1")).thenReturn(
            new RenderSnapshot(4, List.of(trace("a", 48.85, 2.35, 1)), clock.instant()));

        mockMvc.perform(get("/v1/sessions/s-1/traces").param("since", "3"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(1))
            .andExpect(jsonPath("$.data[0].id").value("a"))
            .andExpect(jsonPath("$.meta.version").value(4));

        mockMvc.perform(get("/v1/sessions/s-1/traces"))
            .andExpect(status().isOk());
    }

    @Test
    public void unknownSessionIsNotFound() throws Exception {
        when(registry.latestRender("gone")).thenThrow(new SessionNotFoundException("gone"));
        doThrow(new SessionNotFoundException("gone")).when(registry).close("gone");

        mockMvc.perform(get("/v1/sessions/gone/traces"))
            .andExpect(status().isNotFound());
        mockMvc.perform(delete("/v1/sessions/gone"))
            .andExpect(status().isNotFound());
    }

    @Test
    public void closeEndsTheSession() throws Exception {
        mockMvc.perform(delete("/v1/sessions/s-1"))
            .andExpect(status().isNoContent());

        verify(registry).close("s-1");
    }
}
