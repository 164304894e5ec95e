package org.muma.respkv.store;

import org.muma.respkv.common.Bytes;
import org.muma.respkv.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Active expiration (a simplified form of Redis' activeExpireCycle).
 * <p>
 * Each tick samples a bounded number of keys that carry an expiry and asks the store to drop
 * the elapsed ones. Removal goes through {@link StorageEngine#expireIfElapsed}, which re-checks
 * under the key's lock, so a client that re-set the key in the meantime always wins. When more
 * than a quarter of a sample was expired the cycle repeats, until the tick's time budget is spent.
 * <p>
 * The sampling iterator survives across ticks, so consecutive cycles walk different keys.
 */
public class ExpirationReaper {

    private static final Logger log = LoggerFactory.getLogger(ExpirationReaper.class);

    private static final int ACCEPTABLE_STALE_PERCENT = 25;

    private final StorageEngine storage;
    private final int sampleSize;
    private final long periodMillis;
    private final long budgetNanos;
    private final long stopTimeoutMillis;

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> task;
    private Iterator<Bytes> cursor;

    private volatile long totalExpired;

    /**
     * @param hz         cycles per second
     * @param sampleSize keys examined per sample
     */
    public ExpirationReaper(StorageEngine storage, int hz, int sampleSize) {
        this(storage, hz, sampleSize, 5000);
    }

    /**
     * @param stopTimeoutMillis how long {@link #stop()} waits for a running cycle
     */
    public ExpirationReaper(StorageEngine storage, int hz, int sampleSize, long stopTimeoutMillis) {
        this.storage = storage;
        this.stopTimeoutMillis = Math.max(0, stopTimeoutMillis);
        this.sampleSize = Math.max(1, sampleSize);
        this.periodMillis = Math.max(1, 1000 / Math.max(1, hz));
        // spend at most a quarter of the period per tick
        this.budgetNanos = TimeUnit.MILLISECONDS.toNanos(periodMillis) / 4;
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(ThreadUtils.namedThreadFactory("kv-expire"));
        task = executor.scheduleAtFixedRate(this::safeCycle, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        log.info("Expiration reaper started: period={}ms, sample={}", periodMillis, sampleSize);
    }

    /**
     * Cancels the schedule and waits for a cycle in progress to finish.
     */
    public synchronized void stop() {
        if (task == null) {
            return;
        }
        task.cancel(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(stopTimeoutMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Expiration reaper did not stop within {}ms", stopTimeoutMillis);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        task = null;
        executor = null;
        log.info("Expiration reaper stopped, {} keys expired actively", totalExpired);
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    private void safeCycle() {
        try {
            runCycle();
        } catch (RuntimeException e) {
            // an exception would silently cancel the periodic task
            log.error("Active expire cycle failed", e);
        }
    }

    /**
     * One tick. Package visible so tests can drive it without the scheduler.
     *
     * @return keys removed during this tick
     */
    int runCycle() {
        long deadline = System.nanoTime() + budgetNanos;
        int expiredThisTick = 0;
        while (true) {
            if (storage.volatileSize() == 0) {
                break;
            }
            int sampled = 0;
            int expired = 0;
            while (sampled < sampleSize) {
                if (cursor == null || !cursor.hasNext()) {
                    cursor = storage.volatileKeys();
                    if (!cursor.hasNext()) {
                        break;
                    }
                }
                Bytes key = cursor.next();
                sampled++;
                if (storage.expireIfElapsed(key)) {
                    expired++;
                }
            }
            expiredThisTick += expired;
            boolean mostlyFresh = sampled == 0 || expired * 100 <= sampled * ACCEPTABLE_STALE_PERCENT;
            if (mostlyFresh || System.nanoTime() >= deadline) {
                break;
            }
        }
        if (expiredThisTick > 0) {
            totalExpired += expiredThisTick;
            log.debug("Active expire: removed {} keys, {} volatile keys left", expiredThisTick, storage.volatileSize());
        }
        return expiredThisTick;
    }

    public long getTotalExpired() {
        return totalExpired;
    }
}
