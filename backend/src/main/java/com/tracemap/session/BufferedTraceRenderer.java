package com.tracemap.session;

import java.time.Clock;
import java.util.List;

import com.tracemap.model.TraceRecord;

public class BufferedTraceRenderer implements TraceRenderer {

    private final Clock clock;
    private volatile RenderSnapshot latest;

    public BufferedTraceRenderer(Clock clock) {
        this.clock = clock;
        this.latest = new RenderSnapshot(0, List.of(), clock.instant());
    }

    @Override
    public synchronized void onFetchResult(List<TraceRecord> records) {
        latest = new RenderSnapshot(latest.getVersion() + 1, records, clock.instant());
    }

    public RenderSnapshot latest() {
        return latest;
    }
}
