package com.tracemap.util;

import java.util.UUID;

import com.tracemap.exception.TraceNotFoundException;

public final class TraceIds {

    private TraceIds() {
    }

    /**
     * Parses a trace id from a path. A malformed id cannot name a stored trace, so it is a 404.
     */
    public static UUID parse(String traceId) {
        try {
            return UUID.fromString(traceId);
        } catch (IllegalArgumentException e) {
            throw new TraceNotFoundException(traceId);
        }
    }
}
