package com.tracemap.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracemap.config.AppProperties;
import com.tracemap.dto.CreateTraceRequest;
import com.tracemap.exception.TraceNotFoundException;
import com.tracemap.geo.GeohashCodec;
import com.tracemap.model.Trace;
import com.tracemap.model.TraceRecord;
import com.tracemap.model.Viewport;
import com.tracemap.repository.TraceRepository;

import static com.tracemap.support.Traces.trace;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TraceServiceTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-07-18T09:00:00Z"), ZoneOffset.UTC);
    private final AppProperties properties = new AppProperties();

    private TraceFetchOrchestrator orchestrator;
    private TraceRepository traceRepository;
    private CacheService cacheService;
    private TraceService traceService;

    @BeforeEach
    public void setUp() {
        orchestrator = mock(TraceFetchOrchestrator.class);
        traceRepository = mock(TraceRepository.class);
        cacheService = mock(CacheService.class);
        when(cacheService.get(anyString(), any())).thenReturn(Optional.empty());
        traceService = new TraceService(orchestrator, traceRepository, cacheService, properties,
            new ObjectMapper().findAndRegisterModules(), clock);
    }

    @Test
    public void viewportMissFetchesAndCaches() {
        Viewport viewport = Viewport.of(48.8566, 2.3522, 0.05, 0.05);
        ViewportFetchResult result = new ViewportFetchResult(List.of(trace("a", 48.86, 2.35, 1)), FetchStage.PRIMARY, 5, 4, 0);
        when(orchestrator.fetch(viewport)).thenReturn(result);

        assertSame(result, traceService.viewport(viewport));

        verify(cacheService).set(eq("viewport:48.857:2.352:0.050:0.050"), eq(result), eq(Duration.ofSeconds(60)));
    }

    @Test
    public void viewportHitSkipsTheStore() {
        Viewport viewport = Viewport.of(48.8566, 2.3522, 0.05, 0.05);
        ViewportFetchResult cached = new ViewportFetchResult(List.of(), FetchStage.EMPTY, 5, 4, 0);
        when(cacheService.get("viewport:48.857:2.352:0.050:0.050", ViewportFetchResult.class)).thenReturn(Optional.of(cached));

        assertSame(cached, traceService.viewport(viewport));

        verify(orchestrator, never()).fetch(any(Viewport.class));
    }

    @Test
    public void degradedViewportIsNotCached() {
        Viewport viewport = Viewport.of(48.8566, 2.3522, 0.05, 0.05);
        when(orchestrator.fetch(viewport)).thenReturn(new ViewportFetchResult(List.of(), FetchStage.EMPTY, 5, 4, 4));

        assertTrue(traceService.viewport(viewport).isDegraded());

        verify(cacheService, never()).set(anyString(), any(), any(Duration.class));
    }

    @Test
    public void partiallyFailedViewportIsNotCached() {
        Viewport viewport = Viewport.of(48.8566, 2.3522, 0.05, 0.05);
        ViewportFetchResult partial = new ViewportFetchResult(List.of(trace("a", 48.86, 2.35, 1)), FetchStage.PRIMARY, 5, 4, 3);
        when(orchestrator.fetch(viewport)).thenReturn(partial);

        assertSame(partial, traceService.viewport(viewport));
        assertFalse(partial.isDegraded());

        verify(cacheService, never()).set(anyString(), any(), any(Duration.class));
    }

    @Test
    public void createIndexesAtWritePrecisionAndInvalidatesViewports() {
        UUID id = UUID.randomUUID();
        when(traceRepository.save(any(Trace.class))).thenAnswer(invocation -> {
            Trace saved = invocation.getArgument(0);
            saved.setId(id);
            return saved;
        });
        CreateTraceRequest request = new CreateTraceRequest();
        request.setName("  Bells of Notre-Dame ");
        request.setLatitude(48.8530);
        request.setLongitude(2.3499);
        request.setMediaRefs(Map.of("audio", "audio/bells.m4a"));

        TraceRecord created = traceService.create(request, "user-7");

        ArgumentCaptor<Trace> captor = ArgumentCaptor.forClass(Trace.class);
        verify(traceRepository).save(captor.capture());
        Trace stored = captor.getValue();
        assertEquals(GeohashCodec.encode(48.8530, 2.3499, 8), stored.getGeohash());
        assertEquals("Bells of Notre-Dame", stored.getName());
        assertEquals("user-7", stored.getUploaderId());
        assertEquals(4326, stored.getLocation().getSRID());
        assertEquals(2.3499, stored.getLocation().getX());
        assertEquals(48.8530, stored.getLocation().getY());

        assertEquals(id.toString(), created.getId());
        assertEquals(Map.of("audio", "audio/bells.m4a"), created.getMediaRefs());
        assertEquals(clock.instant(), created.getCreatedAt());
        verify(cacheService).deleteByPattern("viewport:*");
        verify(cacheService).deleteByPattern("summaries:regions");
    }

    @Test
    public void getByIdReadsThroughTheCache() {
        UUID id = UUID.randomUUID();
        Trace trace = new Trace();
        trace.setId(id);
        trace.setName("Fountain");
        trace.setLat(41.9009);
        trace.setLng(12.4833);
        trace.setGeohash(GeohashCodec.encode(41.9009, 12.4833, 8));
        trace.setMediaRefs("{\"image\":\"images/f.jpg\"}");
        trace.setCreatedAt(Instant.parse("2025-07-01T10:00:00Z"));
        when(traceRepository.findById(id)).thenReturn(Optional.of(trace));

        TraceRecord record = traceService.getById(id.toString());

        assertEquals("Fountain", record.getName());
        assertEquals(Map.of("image", "images/f.jpg"), record.getMediaRefs());
        verify(cacheService).set(eq("trace:" + id), eq(record), eq(Duration.ofSeconds(600)));
    }

    @Test
    public void unknownOrMalformedIdIsNotFound() {
        when(traceRepository.findById(any(UUID.class))).thenReturn(Optional.empty());

        assertThrows(TraceNotFoundException.class, () -> traceService.getById(UUID.randomUUID().toString()));
        assertThrows(TraceNotFoundException.class, () -> traceService.getById("not-a-uuid"));
    }
}
