package com.tracemap.session;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.BooleanSupplier;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tracemap.model.Viewport;
import com.tracemap.service.FetchStage;
import com.tracemap.service.ViewportFetchResult;

import static com.tracemap.support.Traces.trace;
import static org.junit.jupiter.api.Assertions.*;

public class ViewportGateTest {

    private static final Duration SETTLE = Duration.ofMillis(100);

    private ScheduledExecutorService eventLoop;
    private final List<Viewport> fetched = new CopyOnWriteArrayList<>();
    private final List<CompletableFuture<ViewportFetchResult>> pendingCycles = new CopyOnWriteArrayList<>();
    private final List<ViewportFetchResult> delivered = new CopyOnWriteArrayList<>();

    @BeforeEach
    public void setUp() {
        eventLoop = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    public void tearDown() {
        eventLoop.shutdownNow();
    }

    @Test
    public void burstOfChangesIssuesOneFetchForTheLastViewport() throws InterruptedException {
        ViewportGate gate = immediateGate();
        Viewport last = null;
        for (int i = 0; i < 10; i++) {
            last = Viewport.of(48.0 + i * 0.01, 2.0, 0.05, 0.05);
            gate.onViewportChanged(last);
        }

        awaitUntil(() -> delivered.size() == 1);
        Thread.sleep(SETTLE.toMillis() * 3);

        assertEquals(1, gate.getCyclesIssued());
        assertEquals(List.of(last), fetched);
        assertEquals(1, delivered.size());
    }

    @Test
    public void subThresholdJitterIsSkipped() throws InterruptedException {
        ViewportGate gate = immediateGate();
        gate.onViewportChanged(Viewport.of(48.85660, 2.35220, 0.05, 0.05));
        awaitUntil(() -> delivered.size() == 1);

        gate.onViewportChanged(Viewport.of(48.85661, 2.35219, 0.05, 0.05));
        awaitUntil(() -> gate.getCyclesSkipped() == 1);

        assertEquals(1, gate.getCyclesIssued());
        assertEquals(1, fetched.size());
        assertEquals("48.857:2.352:0.050:0.050", gate.getLastCompletedKey());
    }

    @Test
    public void separateMovesEachFetch() {
        ViewportGate gate = immediateGate();
        gate.onViewportChanged(Viewport.of(48.0, 2.0, 0.05, 0.05));
        awaitUntil(() -> delivered.size() == 1);
        gate.onViewportChanged(Viewport.of(51.5, -0.12, 0.05, 0.05));
        awaitUntil(() -> delivered.size() == 2);

        assertEquals(2, gate.getCyclesIssued());
        assertEquals(0, gate.getCyclesSkipped());
    }

    @Test
    public void resultOfSupersededCycleIsDiscarded() {
        ViewportGate gate = new ViewportGate(eventLoop, SETTLE, 3, this::deferredFetch, delivered::add);
        gate.onViewportChanged(Viewport.of(48.0, 2.0, 0.05, 0.05));
        awaitUntil(() -> pendingCycles.size() == 1);
        gate.onViewportChanged(Viewport.of(51.5, -0.12, 0.05, 0.05));
        awaitUntil(() -> pendingCycles.size() == 2);

        ViewportFetchResult stale = result("stale");
        ViewportFetchResult fresh = result("fresh");
        pendingCycles.get(0).complete(stale);
        awaitUntil(() -> gate.getStaleDiscarded() == 1);
        pendingCycles.get(1).complete(fresh);
        awaitUntil(() -> delivered.size() == 1);

        assertSame(fresh, delivered.get(0));
        assertEquals("51.500:-0.120:0.050:0.050", gate.getLastCompletedKey());
    }

    @Test
    public void returningToTheRenderedViewportDropsTheInFlightCycle() {
        ViewportGate gate = new ViewportGate(eventLoop, SETTLE, 3, this::deferredFetch, delivered::add);
        Viewport home = Viewport.of(48.0, 2.0, 0.05, 0.05);
        gate.onViewportChanged(home);
        awaitUntil(() -> pendingCycles.size() == 1);
        pendingCycles.get(0).complete(result("home"));
        awaitUntil(() -> delivered.size() == 1);

        gate.onViewportChanged(Viewport.of(51.5, -0.12, 0.05, 0.05));
        awaitUntil(() -> pendingCycles.size() == 2);
        gate.onViewportChanged(home);
        awaitUntil(() -> gate.getCyclesSkipped() == 1);
        pendingCycles.get(1).complete(result("away"));
        awaitUntil(() -> gate.getStaleDiscarded() == 1);

        assertEquals(1, delivered.size());
    }

    @Test
    public void failedCycleDeliversNothingAndAllowsRetry() {
        ViewportGate gate = new ViewportGate(eventLoop, SETTLE, 3, this::deferredFetch, delivered::add);
        Viewport viewport = Viewport.of(48.0, 2.0, 0.05, 0.05);
        gate.onViewportChanged(viewport);
        awaitUntil(() -> pendingCycles.size() == 1);
        pendingCycles.get(0).completeExceptionally(new IllegalStateException("boom"));

        gate.onViewportChanged(viewport);
        awaitUntil(() -> pendingCycles.size() == 2);

        assertTrue(delivered.isEmpty());
        assertEquals(2, gate.getCyclesIssued());
    }

    private ViewportGate immediateGate() {
        return new ViewportGate(eventLoop, SETTLE, 3, viewport -> {
            fetched.add(viewport);
            return CompletableFuture.completedFuture(result(viewport.quantizedKey(3)));
        }, delivered::add);
    }

    private CompletableFuture<ViewportFetchResult> deferredFetch(Viewport viewport) {
        fetched.add(viewport);
        CompletableFuture<ViewportFetchResult> cycle = new CompletableFuture<>();
        pendingCycles.add(cycle);
        return cycle;
    }

    private static ViewportFetchResult result(String id) {
        return new ViewportFetchResult(List.of(trace(id, 1.0, 1.0, 1)), FetchStage.PRIMARY, 6, 1, 0);
    }

    private static void awaitUntil(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not met within 5s");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("interrupted");
            }
        }
    }
}
