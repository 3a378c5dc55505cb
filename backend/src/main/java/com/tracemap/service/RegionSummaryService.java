package com.tracemap.service;

import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracemap.config.AppProperties;
import com.tracemap.dto.RegionSummaryDto;
import com.tracemap.store.TraceStore;

/**
 * Coarse zoomed-out view: one aggregate count per configured region instead of individual traces.
 * Regions with no traces, or whose count query failed, are left out.
 */
@Service
public class RegionSummaryService {

    private static final Logger log = LoggerFactory.getLogger(RegionSummaryService.class);

    static final String CACHE_KEY = "summaries:regions";
    static final String REGIONS_RESOURCE = "regions/regions.json";

    private final TraceStore traceStore;
    private final Executor queryExecutor;
    private final CacheService cacheService;
    private final AppProperties appProperties;
    private final List<GeographicRegion> regions;

    public RegionSummaryService(
        TraceStore traceStore,
        @Qualifier("traceQueryExecutor") Executor queryExecutor,
        CacheService cacheService,
        AppProperties appProperties,
        ObjectMapper objectMapper
    ) {
        this.traceStore = traceStore;
        this.queryExecutor = queryExecutor;
        this.cacheService = cacheService;
        this.appProperties = appProperties;
        this.regions = loadRegions(objectMapper);
    }

    public List<RegionSummaryDto> summaries() {
        Optional<RegionSummaryDto[]> cached = cacheService.get(CACHE_KEY, RegionSummaryDto[].class);
        if (cached.isPresent()) {
            return Arrays.asList(cached.get());
        }

        AtomicBoolean anyFailed = new AtomicBoolean();
        List<CompletableFuture<RegionSummaryDto>> counts = new ArrayList<>();
        for (GeographicRegion region : regions) {
            counts.add(count(region, anyFailed));
        }
        List<RegionSummaryDto> summaries = counts.stream()
            .map(CompletableFuture::join)
            .filter(Objects::nonNull)
            .collect(Collectors.toList());

        // a partial answer is still worth showing but not worth caching
        if (!anyFailed.get()) {
            cacheService.set(CACHE_KEY, summaries, Duration.ofSeconds(appProperties.getCache().getViewportSeconds()));
        }
        return summaries;
    }

    public List<GeographicRegion> getRegions() {
        return regions;
    }

    private CompletableFuture<RegionSummaryDto> count(GeographicRegion region, AtomicBoolean anyFailed) {
        CompletableFuture<Long> query;
        try {
            query = CompletableFuture.supplyAsync(() -> traceStore.countInBox(region.boundingBox()), queryExecutor)
                .orTimeout(appProperties.getFetch().getCellTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            query = CompletableFuture.failedFuture(e);
        }
        return query.handle((count, error) -> {
            if (error != null) {
                anyFailed.set(true);
                log.warn("Count for region {} failed: {}", region.getName(), error.getMessage());
                return null;
            }
            if (count == 0) {
                return null;
            }
            return new RegionSummaryDto(region.getName(), count, region.center());
        });
    }

    private List<GeographicRegion> loadRegions(ObjectMapper objectMapper) {
        try (InputStream is = new ClassPathResource(REGIONS_RESOURCE).getInputStream()) {
            List<GeographicRegion> loaded = objectMapper.readValue(is, new TypeReference<List<GeographicRegion>>() {
            });
            log.info("Loaded {} summary regions", loaded.size());
            return loaded;
        } catch (Exception ex) {
            log.warn("Failed to load {}, region summaries disabled: {}", REGIONS_RESOURCE, ex.getMessage());
            return new ArrayList<>();
        }
    }
}
