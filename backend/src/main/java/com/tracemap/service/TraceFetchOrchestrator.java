package com.tracemap.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.tracemap.config.AppProperties;
import com.tracemap.geo.GeohashCodec;
import com.tracemap.model.BoundingBox;
import com.tracemap.model.TraceRecord;
import com.tracemap.model.Viewport;
import com.tracemap.store.TraceStore;

/**
 * Fans a cover set out into one range query per prefix, merges by id, keeps only records inside
 * the viewport box and sorts them newest first. When that leaves nothing, falls back to the
 * neighbor cells of the center, then (world scale only) to a global sample of recent traces.
 *
 * <p>A failed or timed-out cell counts as an empty cell. Nothing here throws for store trouble.
 */
@Service
public class TraceFetchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TraceFetchOrchestrator.class);

    static final Comparator<TraceRecord> NEWEST_FIRST = Comparator
        .comparing(TraceRecord::getCreatedAt, Comparator.reverseOrder())
        .thenComparing(TraceRecord::getId);

    private final TraceStore traceStore;
    private final CoveragePlanner planner;
    private final Executor queryExecutor;
    private final long cellTimeoutMs;
    private final int globalSampleLimit;

    public TraceFetchOrchestrator(
        TraceStore traceStore,
        CoveragePlanner planner,
        @Qualifier("traceQueryExecutor") Executor queryExecutor,
        AppProperties appProperties
    ) {
        this.traceStore = traceStore;
        this.planner = planner;
        this.queryExecutor = queryExecutor;
        this.cellTimeoutMs = appProperties.getFetch().getCellTimeoutMs();
        this.globalSampleLimit = appProperties.getFetch().getGlobalSampleLimit();
    }

    public ViewportFetchResult fetch(Viewport viewport) {
        return fetchAsync(viewport).join();
    }

    public CompletableFuture<ViewportFetchResult> fetchAsync(Viewport viewport) {
        CoveragePlan plan = planner.plan(viewport);
        return fetchAsync(viewport, plan.getPrefixes(), plan.getPrecision(), plan.getPerCellLimit());
    }

    /**
     * Runs one cycle over an explicit cover set. {@code precision} is the precision the prefixes
     * were planned at; the neighbor tier re-encodes the center at that precision.
     */
    public CompletableFuture<ViewportFetchResult> fetchAsync(
        Viewport viewport, Collection<String> prefixes, int precision, int perCellLimit) {
        BoundingBox box = viewport.boundingBox();
        return sweep(prefixes, perCellLimit).thenCompose(primary -> {
            List<TraceRecord> kept = primary.keepWithin(box);
            if (!kept.isEmpty()) {
                return CompletableFuture.completedFuture(
                    finish(viewport, FetchStage.PRIMARY, kept, precision, primary, null));
            }

            List<String> neighbors = planner.neighborPrefixes(viewport.getCenter(), precision).stream()
                .filter(prefix -> !primary.succeeded.contains(prefix))
                .collect(Collectors.toList());
            return sweep(neighbors, perCellLimit).thenCompose(neighborSweep -> {
                List<TraceRecord> nearby = neighborSweep.keepWithin(box);
                if (!nearby.isEmpty()) {
                    return CompletableFuture.completedFuture(
                        finish(viewport, FetchStage.NEIGHBORS, nearby, precision, primary, neighborSweep));
                }
                if (!planner.isWorldScale(viewport.getSpan())) {
                    return CompletableFuture.completedFuture(
                        finish(viewport, FetchStage.EMPTY, List.of(), precision, primary, neighborSweep));
                }
                return globalSample(box).thenApply(sample -> finish(viewport,
                    sample.isEmpty() ? FetchStage.EMPTY : FetchStage.GLOBAL_SAMPLE,
                    sample, precision, primary, neighborSweep));
            });
        });
    }

    private CompletableFuture<CellSweep> sweep(Collection<String> prefixes, int perCellLimit) {
        CellSweep sweep = new CellSweep(prefixes.size());
        CompletableFuture<?>[] cells = prefixes.stream()
            .map(prefix -> queryCell(prefix, perCellLimit).handle((records, error) -> {
                if (error != null) {
                    sweep.recordFailure(prefix, error);
                } else {
                    sweep.recordSuccess(prefix, records);
                }
                return null;
            }))
            .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(cells).thenApply(ignored -> sweep);
    }

    private CompletableFuture<List<TraceRecord>> queryCell(String prefix, int perCellLimit) {
        String upper = GeohashCodec.upperBound(prefix);
        return submit(() -> traceStore.findByGeohashRange(prefix, upper, perCellLimit));
    }

    private CompletableFuture<List<TraceRecord>> globalSample(BoundingBox box) {
        log.info("Viewport fan-out came back empty at world scale, sampling {} recent traces", globalSampleLimit);
        return submit(() -> traceStore.findRecent(globalSampleLimit)).handle((records, error) -> {
            if (error != null) {
                log.warn("Global sample query failed: {}", rootMessage(error));
                return List.of();
            }
            return records.stream()
                .filter(record -> box.contains(record.getCoordinate()))
                .sorted(NEWEST_FIRST)
                .collect(Collectors.toList());
        });
    }

    private CompletableFuture<List<TraceRecord>> submit(Supplier<List<TraceRecord>> query) {
        try {
            return CompletableFuture.supplyAsync(query, queryExecutor)
                .orTimeout(cellTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private ViewportFetchResult finish(Viewport viewport, FetchStage stage, List<TraceRecord> records,
                                       int precision, CellSweep primary, CellSweep neighbors) {
        int queried = primary.size + (neighbors != null ? neighbors.size : 0);
        int failed = primary.failedCount() + (neighbors != null ? neighbors.failedCount() : 0);
        ViewportFetchResult result = new ViewportFetchResult(records, stage, precision, queried, failed);
        if (result.isDegraded()) {
            log.warn("All {} cell queries failed for {}", queried, viewport);
        } else {
            log.debug("Fetched {} for {}", result, viewport);
        }
        return result;
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    /**
     * Merge accumulator for one tier. Cell completions race to insert, so every collection is concurrent.
     */
    private static final class CellSweep {

        private final int size;
        private final Map<String, TraceRecord> merged = new ConcurrentHashMap<>();
        private final Set<String> succeeded = ConcurrentHashMap.newKeySet();
        private final Set<String> failed = ConcurrentHashMap.newKeySet();

        CellSweep(int size) {
            this.size = size;
        }

        void recordSuccess(String prefix, List<TraceRecord> records) {
            for (TraceRecord record : records) {
                merged.put(record.getId(), record);
            }
            succeeded.add(prefix);
        }

        void recordFailure(String prefix, Throwable error) {
            failed.add(prefix);
            log.warn("Cell query for prefix {} failed, treating as empty: {}", prefix, rootMessage(error));
        }

        int failedCount() {
            return failed.size();
        }

        List<TraceRecord> keepWithin(BoundingBox box) {
            List<TraceRecord> kept = new ArrayList<>();
            for (TraceRecord record : merged.values()) {
                if (box.contains(record.getCoordinate())) {
                    kept.add(record);
                }
            }
            kept.sort(NEWEST_FIRST);
            return kept;
        }
    }
}
