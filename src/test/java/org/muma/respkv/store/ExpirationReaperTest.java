package org.muma.respkv.store;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.respkv.common.Bytes;
import org.muma.respkv.common.RedisString;
import org.muma.respkv.store.impl.MemoryStorageEngine;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ExpirationReaperTest {

    private static final long START = 1_700_000_000_000L;

    private MutableClock clock;
    private MemoryStorageEngine storage;
    private ExpirationReaper reaper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        storage = new MemoryStorageEngine(16, clock);
        reaper = new ExpirationReaper(storage, 10, 20);
    }

    @AfterEach
    void tearDown() {
        reaper.stop();
    }

    private void put(String key, long expireAt) {
        storage.set(Bytes.of(key), RedisString.of("v"));
        if (expireAt > 0) {
            storage.expireAt(Bytes.of(key), expireAt);
        }
    }

    @Test
    void testCycleRemovesOnlyElapsedKeys() {
        for (int i = 0; i < 10; i++) {
            put("soon:" + i, START + 10);
            put("later:" + i, START + 10_000);
            put("forever:" + i, -1);
        }
        clock.advance(10);

        int removed = 0;
        for (int i = 0; i < 20 && storage.volatileSize() > 10; i++) {
            removed += reaper.runCycle();
        }

        assertEquals(10, removed);
        assertEquals(20, storage.size());
        assertEquals(10, storage.volatileSize());
        assertEquals(10, reaper.getTotalExpired());
    }

    @Test
    void testMostlyExpiredSampleRepeatsWithinOneTick() {
        for (int i = 0; i < 200; i++) {
            put("k" + i, START + 1);
        }
        clock.advance(1);

        int removed = reaper.runCycle();

        // one sample is 20 keys; an all-expired sample triggers another round
        assertTrue(removed > 20, "removed " + removed);
    }

    @Test
    void testNothingDueNothingRemoved() {
        for (int i = 0; i < 50; i++) {
            put("k" + i, START + 1000);
        }
        assertEquals(0, reaper.runCycle());
        assertEquals(50, storage.size());
    }

    @Test
    void testScheduledReaperClearsKeysNobodyReads() throws InterruptedException {
        MemoryStorageEngine live = new MemoryStorageEngine(16, Clock.systemUTC());
        ExpirationReaper liveReaper = new ExpirationReaper(live, 50, 20);
        long now = System.currentTimeMillis();
        for (int i = 0; i < 100; i++) {
            live.set(Bytes.of("k" + i), RedisString.of("v"));
            live.expireAt(Bytes.of("k" + i), now + 50);
        }
        live.set(Bytes.of("keep"), RedisString.of("v"));

        liveReaper.start();
        try {
            assertTrue(liveReaper.isRunning());
            long deadline = System.currentTimeMillis() + 5000;
            // size() counts entries without resolving them, so only the reaper can shrink it
            while (live.size() > 1 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertEquals(1, live.size());
            assertEquals(0, live.volatileSize());
        } finally {
            liveReaper.stop();
        }
        assertFalse(liveReaper.isRunning());
    }

    @Test
    void testStopIsIdempotent() {
        reaper.start();
        reaper.start();
        reaper.stop();
        reaper.stop();
        assertFalse(reaper.isRunning());
    }

    @Test
    void testStopGivesUpOnAStuckCycleAfterTheConfiguredTimeout() throws InterruptedException {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        StorageEngine stuck = mock(StorageEngine.class);
        when(stuck.volatileSize()).thenAnswer(invocation -> {
            entered.countDown();
            release.await(10, TimeUnit.SECONDS);
            return 0;
        });
        ExpirationReaper slowReaper = new ExpirationReaper(stuck, 100, 20, 200);
        slowReaper.start();
        try {
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            long begin = System.nanoTime();
            slowReaper.stop();
            long tookMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);

            assertFalse(slowReaper.isRunning());
            assertTrue(tookMillis >= 150 && tookMillis < 3000, "stop took " + tookMillis + "ms");
        } finally {
            release.countDown();
        }
    }
}
