package com.tracemap.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.tracemap.config.AppProperties;
import com.tracemap.exception.SessionLimitExceededException;
import com.tracemap.exception.SessionNotFoundException;
import com.tracemap.model.Viewport;
import com.tracemap.service.TraceFetchOrchestrator;

import jakarta.annotation.PreDestroy;

/**
 * Live map sessions by id. Sessions idle longer than {@code app.session.idle-timeout-seconds}
 * are closed by a periodic sweep. Each session owns an event thread, so at most
 * {@code app.session.max-live} are open at once.
 */
@Component
public class MapSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(MapSessionRegistry.class);

    private final TraceFetchOrchestrator orchestrator;
    private final AppProperties appProperties;
    private final Clock clock;
    private final Map<String, Entry> sessions = new ConcurrentHashMap<>();

    public MapSessionRegistry(TraceFetchOrchestrator orchestrator, AppProperties appProperties, Clock clock) {
        this.orchestrator = orchestrator;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    public synchronized MapSession create() {
        int maxLive = appProperties.getSession().getMaxLive();
        if (sessions.size() >= maxLive) {
            log.warn("Refusing new map session, {} already live", sessions.size());
            throw new SessionLimitExceededException(maxLive);
        }
        String id = UUID.randomUUID().toString();
        BufferedTraceRenderer renderer = new BufferedTraceRenderer(clock);
        MapSession session = new MapSession(id, orchestrator, renderer, appProperties, clock);
        sessions.put(id, new Entry(session, renderer));
        log.info("Opened map session {} ({} live)", id, sessions.size());
        return session;
    }

    public MapSession get(String sessionId) {
        return entry(sessionId).session;
    }

    public void pushViewport(String sessionId, Viewport viewport) {
        entry(sessionId).session.onViewportChanged(viewport);
    }

    public RenderSnapshot latestRender(String sessionId) {
        Entry entry = entry(sessionId);
        entry.session.touch();
        return entry.renderer.latest();
    }

    public void close(String sessionId) {
        Entry entry = sessions.remove(sessionId);
        if (entry == null) {
            throw new SessionNotFoundException(sessionId);
        }
        entry.session.close();
        log.info("Closed map session {} ({} live)", sessionId, sessions.size());
    }

    public int size() {
        return sessions.size();
    }

    @Scheduled(fixedDelayString = "${app.session.eviction-interval-ms:60000}")
    public void evictIdle() {
        Instant cutoff = clock.instant().minus(Duration.ofSeconds(appProperties.getSession().getIdleTimeoutSeconds()));
        int evicted = 0;
        Iterator<Entry> it = sessions.values().iterator();
        while (it.hasNext()) {
            MapSession session = it.next().session;
            if (session.isIdleSince(cutoff)) {
                it.remove();
                session.close();
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} idle map sessions ({} live)", evicted, sessions.size());
        }
    }

    @PreDestroy
    public void closeAll() {
        sessions.values().forEach(entry -> entry.session.close());
        sessions.clear();
    }

    private Entry entry(String sessionId) {
        Entry entry = sessions.get(sessionId);
        if (entry == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return entry;
    }

    private static final class Entry {
        private final MapSession session;
        private final BufferedTraceRenderer renderer;

        Entry(MapSession session, BufferedTraceRenderer renderer) {
            this.session = session;
            this.renderer = renderer;
        }
    }
}
