package com.tracemap.support;

import java.time.Instant;
import java.util.Map;

import com.tracemap.geo.GeohashCodec;
import com.tracemap.model.Coordinate;
import com.tracemap.model.TraceRecord;

public final class Traces {

    public static final Instant EPOCH = Instant.parse("2025-07-01T12:00:00Z");

    private Traces() {
    }

    /**
     * A trace indexed at write precision 8, created {@code minutesAfterEpoch} after {@link #EPOCH}.
     */
    public static TraceRecord trace(String id, double lat, double lng, long minutesAfterEpoch) {
        return new TraceRecord(id, "trace " + id, new Coordinate(lat, lng), GeohashCodec.encode(lat, lng, 8),
            Map.of("image", "images/" + id + ".jpg", "audio", "audio/" + id + ".m4a"),
            EPOCH.plusSeconds(minutesAfterEpoch * 60));
    }
}
