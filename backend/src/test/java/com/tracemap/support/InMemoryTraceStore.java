package com.tracemap.support;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import com.tracemap.model.BoundingBox;
import com.tracemap.model.TraceRecord;
import com.tracemap.store.StoreQueryException;
import com.tracemap.store.TraceStore;

/**
 * Trace store over a list, with the same range semantics as the SQL store (code-point string
 * order) and switches to make queries fail.
 */
public class InMemoryTraceStore implements TraceStore {

    private final List<TraceRecord> records = new CopyOnWriteArrayList<>();
    private final Set<String> failingPrefixes = ConcurrentHashMap.newKeySet();
    private final Map<String, AtomicInteger> rangeQueriesByPrefix = new ConcurrentHashMap<>();
    private final AtomicInteger rangeQueries = new AtomicInteger();
    private final AtomicInteger recentQueries = new AtomicInteger();

    private volatile boolean rangeOutage;
    private volatile boolean recentOutage;

    public InMemoryTraceStore add(TraceRecord record) {
        records.add(record);
        return this;
    }

    public InMemoryTraceStore addAll(Collection<TraceRecord> more) {
        records.addAll(more);
        return this;
    }

    public void failPrefix(String prefix) {
        failingPrefixes.add(prefix);
    }

    public void failRangeQueries() {
        rangeOutage = true;
    }

    public void failEverything() {
        rangeOutage = true;
        recentOutage = true;
    }

    public int rangeQueries() {
        return rangeQueries.get();
    }

    public int rangeQueries(String prefix) {
        AtomicInteger count = rangeQueriesByPrefix.get(prefix);
        return count == null ? 0 : count.get();
    }

    public int recentQueries() {
        return recentQueries.get();
    }

    @Override
    public List<TraceRecord> findByGeohashRange(String lowerInclusive, String upperExclusive, int limit) {
        rangeQueries.incrementAndGet();
        rangeQueriesByPrefix.computeIfAbsent(lowerInclusive, k -> new AtomicInteger()).incrementAndGet();
        if (rangeOutage || failingPrefixes.contains(lowerInclusive)) {
            throw new StoreQueryException("simulated outage for " + lowerInclusive);
        }
        return records.stream()
            .filter(r -> r.getGeohash().compareTo(lowerInclusive) >= 0 && r.getGeohash().compareTo(upperExclusive) < 0)
            .sorted((a, b) -> b.getCreatedAt().compareTo(a.getCreatedAt()))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<TraceRecord> findRecent(int limit) {
        recentQueries.incrementAndGet();
        if (recentOutage) {
            throw new StoreQueryException("simulated outage for recent query");
        }
        return records.stream()
            .sorted((a, b) -> b.getCreatedAt().compareTo(a.getCreatedAt()))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public long countInBox(BoundingBox box) {
        return new ArrayList<>(records).stream().filter(r -> box.contains(r.getCoordinate())).count();
    }
}
