package com.tracemap.store;

import java.util.List;

import com.tracemap.model.BoundingBox;
import com.tracemap.model.TraceRecord;

/**
 * Read side of the remote {@code traces} collection. The store only answers simple range
 * queries on one string field plus an aggregate count; there is no spatial query.
 * Implementations throw {@link StoreQueryException} when a query cannot be answered.
 */
public interface TraceStore {

    /**
     * Records with {@code lowerInclusive <= geohash < upperExclusive}, newest first, at most {@code limit}.
     */
    List<TraceRecord> findByGeohashRange(String lowerInclusive, String upperExclusive, int limit);

    /**
     * The {@code limit} most recent records anywhere, newest first.
     */
    List<TraceRecord> findRecent(int limit);

    long countInBox(BoundingBox box);
}
