package com.tracemap.session;

import java.time.Instant;
import java.util.List;

import com.tracemap.model.TraceRecord;

public final class RenderSnapshot {

    private final long version;
    private final List<TraceRecord> records;
    private final Instant renderedAt;

    public RenderSnapshot(long version, List<TraceRecord> records, Instant renderedAt) {
        this.version = version;
        this.records = List.copyOf(records);
        this.renderedAt = renderedAt;
    }

    public long getVersion() {
        return version;
    }

    public List<TraceRecord> getRecords() {
        return records;
    }

    public Instant getRenderedAt() {
        return renderedAt;
    }
}
