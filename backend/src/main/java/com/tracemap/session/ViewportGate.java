package com.tracemap.session;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tracemap.model.Viewport;
import com.tracemap.service.ViewportFetchResult;

/**
 * Trailing debounce in front of the fetch orchestrator.
 *
 * <p>Every camera change restarts the settle timer; only the last viewport of a burst is fetched.
 * A settled viewport whose quantized key equals the key of the last completed cycle is skipped.
 * Each issued cycle gets a sequence number and a result is delivered only if no newer cycle was
 * issued in the meantime.
 *
 * <p>All state lives on {@code eventLoop}, which must be single-threaded.
 */
public class ViewportGate {

    private static final Logger log = LoggerFactory.getLogger(ViewportGate.class);

    private final ScheduledExecutorService eventLoop;
    private final long settleMillis;
    private final int keyDecimals;
    private final Function<Viewport, CompletableFuture<ViewportFetchResult>> fetcher;
    private final Consumer<ViewportFetchResult> onResult;

    private final AtomicLong cyclesIssued = new AtomicLong();
    private final AtomicLong cyclesSkipped = new AtomicLong();
    private final AtomicLong staleDiscarded = new AtomicLong();

    // event loop only
    private Viewport pending;
    private ScheduledFuture<?> settleTimer;
    private long latestSeq;
    private volatile String lastCompletedKey;

    public ViewportGate(
        ScheduledExecutorService eventLoop,
        Duration settleDelay,
        int keyDecimals,
        Function<Viewport, CompletableFuture<ViewportFetchResult>> fetcher,
        Consumer<ViewportFetchResult> onResult
    ) {
        this.eventLoop = eventLoop;
        this.settleMillis = settleDelay.toMillis();
        this.keyDecimals = keyDecimals;
        this.fetcher = fetcher;
        this.onResult = onResult;
    }

    /**
     * Safe to call from any thread at any rate.
     */
    public void onViewportChanged(Viewport viewport) {
        runOnLoop(() -> {
            pending = viewport;
            if (settleTimer != null) {
                settleTimer.cancel(false);
            }
            settleTimer = eventLoop.schedule(this::settle, settleMillis, TimeUnit.MILLISECONDS);
        });
    }

    public long getCyclesIssued() {
        return cyclesIssued.get();
    }

    public long getCyclesSkipped() {
        return cyclesSkipped.get();
    }

    public long getStaleDiscarded() {
        return staleDiscarded.get();
    }

    public String getLastCompletedKey() {
        return lastCompletedKey;
    }

    private void settle() {
        Viewport viewport = pending;
        pending = null;
        settleTimer = null;
        if (viewport == null) {
            return;
        }

        String key = viewport.quantizedKey(keyDecimals);
        if (key.equals(lastCompletedKey)) {
            // back on what is already rendered: anything still in flight is now stale
            latestSeq++;
            cyclesSkipped.incrementAndGet();
            log.debug("Viewport {} unchanged since last cycle, skipping fetch", key);
            return;
        }

        long seq = ++latestSeq;
        cyclesIssued.incrementAndGet();
        log.debug("Issuing fetch cycle {} for {}", seq, key);
        CompletableFuture<ViewportFetchResult> cycle;
        try {
            cycle = fetcher.apply(viewport);
        } catch (RuntimeException e) {
            cycle = CompletableFuture.failedFuture(e);
        }
        cycle.whenComplete((result, error) -> runOnLoop(() -> complete(seq, key, result, error)));
    }

    private void complete(long seq, String key, ViewportFetchResult result, Throwable error) {
        if (seq != latestSeq) {
            staleDiscarded.incrementAndGet();
            log.debug("Discarding result of stale cycle {} (latest {})", seq, latestSeq);
            return;
        }
        if (error != null) {
            log.warn("Fetch cycle {} for {} failed: {}", seq, key, error.getMessage());
            return;
        }
        lastCompletedKey = key;
        onResult.accept(result);
    }

    private void runOnLoop(Runnable task) {
        try {
            eventLoop.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Gate event loop is shut down, dropping event");
        }
    }
}
