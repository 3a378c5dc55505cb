package com.tracemap.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.PrecisionModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracemap.config.AppProperties;
import com.tracemap.dto.CreateTraceRequest;
import com.tracemap.exception.TraceNotFoundException;
import com.tracemap.geo.GeohashCodec;
import com.tracemap.model.Coordinate;
import com.tracemap.model.Trace;
import com.tracemap.model.TraceRecord;
import com.tracemap.model.Viewport;
import com.tracemap.repository.TraceRepository;
import com.tracemap.util.GeoValidator;
import com.tracemap.util.TraceIds;

@Service
public class TraceService {

    private static final Logger log = LoggerFactory.getLogger(TraceService.class);

    static final String VIEWPORT_KEY_PREFIX = "viewport:";
    static final String TRACE_KEY_PREFIX = "trace:";

    private static final TypeReference<Map<String, String>> MEDIA_REFS = new TypeReference<>() {
    };

    private final TraceFetchOrchestrator orchestrator;
    private final TraceRepository traceRepository;
    private final CacheService cacheService;
    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final GeometryFactory geometryFactory = new GeometryFactory(new PrecisionModel(), 4326);

    public TraceService(
        TraceFetchOrchestrator orchestrator,
        TraceRepository traceRepository,
        CacheService cacheService,
        AppProperties appProperties,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.orchestrator = orchestrator;
        this.traceRepository = traceRepository;
        this.cacheService = cacheService;
        this.appProperties = appProperties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * One-shot viewport fetch for stateless clients. Results are cached under the quantized
     * viewport key; a result with any failed cell is not cached.
     */
    public ViewportFetchResult viewport(Viewport viewport) {
        String cacheKey = VIEWPORT_KEY_PREFIX + viewport.quantizedKey(appProperties.getGate().getKeyDecimals());
        Optional<ViewportFetchResult> cached = cacheService.get(cacheKey, ViewportFetchResult.class);
        if (cached.isPresent()) {
            return cached.get();
        }

        ViewportFetchResult result = orchestrator.fetch(viewport);
        if (result.getCellsFailed() == 0) {
            cacheService.set(cacheKey, result, Duration.ofSeconds(appProperties.getCache().getViewportSeconds()));
        }
        return result;
    }

    @Transactional(readOnly = true)
    public TraceRecord getById(String traceId) {
        String cacheKey = TRACE_KEY_PREFIX + traceId;
        Optional<TraceRecord> cached = cacheService.get(cacheKey, TraceRecord.class);
        if (cached.isPresent()) {
            return cached.get();
        }

        UUID id = TraceIds.parse(traceId);
        TraceRecord record = traceRepository.findById(id)
            .map(this::toRecord)
            .orElseThrow(() -> new TraceNotFoundException(traceId));
        cacheService.set(cacheKey, record, Duration.ofSeconds(appProperties.getCache().getTraceSeconds()));
        return record;
    }

    /**
     * Stores a new trace, indexed at the write precision so viewport prefix queries find it.
     */
    @Transactional
    public TraceRecord create(CreateTraceRequest request, String uploaderId) {
        if (!GeoValidator.isValidCoordinate(request.getLatitude(), request.getLongitude())) {
            throw new IllegalArgumentException("lat must be between -90 and 90, lng between -180 and 180");
        }
        double lat = request.getLatitude();
        double lng = request.getLongitude();

        Trace trace = new Trace();
        trace.setName(request.getName().trim());
        trace.setLat(lat);
        trace.setLng(lng);
        Point point = geometryFactory.createPoint(new org.locationtech.jts.geom.Coordinate(lng, lat));
        trace.setLocation(point);
        trace.setGeohash(GeohashCodec.encode(lat, lng, appProperties.getIndex().getWritePrecision()));
        trace.setMediaRefs(writeMediaRefs(request.getMediaRefs()));
        trace.setUploaderId(uploaderId);
        trace.setCreatedAt(clock.instant());

        Trace saved = traceRepository.save(trace);
        log.info("Created trace {} at {} ({})", saved.getId(), saved.getGeohash(), uploaderId);

        cacheService.deleteByPattern(VIEWPORT_KEY_PREFIX + "*");
        cacheService.deleteByPattern(RegionSummaryService.CACHE_KEY);
        return toRecord(saved);
    }

    TraceRecord toRecord(Trace trace) {
        Instant createdAt = trace.getCreatedAt() != null ? trace.getCreatedAt() : clock.instant();
        return new TraceRecord(
            trace.getId().toString(),
            trace.getName(),
            new Coordinate(trace.getLat(), trace.getLng()),
            trace.getGeohash(),
            readMediaRefs(trace),
            createdAt
        );
    }

    private String writeMediaRefs(Map<String, String> mediaRefs) {
        if (mediaRefs == null || mediaRefs.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(mediaRefs);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("mediaRefs must be a map of strings", e);
        }
    }

    private Map<String, String> readMediaRefs(Trace trace) {
        String json = trace.getMediaRefs();
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MEDIA_REFS);
        } catch (JsonProcessingException e) {
            log.warn("Trace {} has unreadable media_refs: {}", trace.getId(), e.getOriginalMessage());
            return Map.of();
        }
    }
}
