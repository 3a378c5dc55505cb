package com.tracemap.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import com.tracemap.config.AppProperties;
import com.tracemap.model.Viewport;
import com.tracemap.service.TraceFetchOrchestrator;
import com.tracemap.service.ViewportFetchResult;

/**
 * One map being viewed. Camera changes go through the gate, settled fetches go to the
 * orchestrator, and results reach the renderer only when the rendered id set changes.
 * The gate and the rendered cache run on this session's own single event thread.
 */
public class MapSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MapSession.class);

    private final String id;
    private final Clock clock;
    private final Instant createdAt;
    private final ScheduledExecutorService eventLoop;
    private final ViewportGate gate;
    private final RenderedTraceCache renderedCache = new RenderedTraceCache();
    private final TraceRenderer renderer;

    private volatile Instant lastActivity;
    private volatile boolean closed;

    public MapSession(String id, TraceFetchOrchestrator orchestrator, TraceRenderer renderer,
                      AppProperties appProperties, Clock clock) {
        this.id = id;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.lastActivity = createdAt;
        this.renderer = renderer;

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("map-session-" + shortId(id) + "-");
        threadFactory.setDaemon(true);
        this.eventLoop = Executors.newSingleThreadScheduledExecutor(threadFactory);

        AppProperties.Gate gateProperties = appProperties.getGate();
        this.gate = new ViewportGate(
            eventLoop,
            Duration.ofMillis(gateProperties.getSettleMillis()),
            gateProperties.getKeyDecimals(),
            orchestrator::fetchAsync,
            this::onCycleResult
        );
    }

    public void onViewportChanged(Viewport viewport) {
        if (closed) {
            throw new IllegalStateException("session " + id + " is closed");
        }
        touch();
        gate.onViewportChanged(viewport);
    }

    public void touch() {
        lastActivity = clock.instant();
    }

    public boolean isIdleSince(Instant cutoff) {
        return lastActivity.isBefore(cutoff);
    }

    public String getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public ViewportGate getGate() {
        return gate;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        eventLoop.shutdownNow();
        log.debug("Closed map session {} after {} fetch cycles", id, gate.getCyclesIssued());
    }

    private void onCycleResult(ViewportFetchResult result) {
        if (renderedCache.offer(result.getRecords())) {
            renderer.onFetchResult(renderedCache.current());
        } else {
            log.debug("Session {}: {} unchanged, render suppressed", id, result);
        }
    }

    private static String shortId(String id) {
        return id.length() > 8 ? id.substring(0, 8) : id;
    }
}
