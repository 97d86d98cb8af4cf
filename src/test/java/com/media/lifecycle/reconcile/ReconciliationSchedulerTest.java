package com.media.lifecycle.reconcile;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReconciliationScheduler Tests")
class ReconciliationSchedulerTest {

    private final ReconciliationScheduler scheduler = new ReconciliationScheduler();

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    @DisplayName("Should run both loops repeatedly")
    void runsBothLoops() throws InterruptedException {
        CountDownLatch full = new CountDownLatch(2);
        CountDownLatch incremental = new CountDownLatch(2);

        scheduler.start(Duration.ofMillis(20), Duration.ofMillis(10), full::countDown, incremental::countDown);

        assertTrue(full.await(5, TimeUnit.SECONDS));
        assertTrue(incremental.await(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("A failing run should not cancel its loop")
    void failingRunKeepsLoopAlive() throws InterruptedException {
        AtomicInteger attempts = new AtomicInteger();
        CountDownLatch thirdAttempt = new CountDownLatch(3);

        scheduler.start(Duration.ofMillis(10), Duration.ofHours(1), () -> {
            attempts.incrementAndGet();
            thirdAttempt.countDown();
            throw new IllegalStateException("boom");
        }, () -> { });

        assertTrue(thirdAttempt.await(5, TimeUnit.SECONDS));
        assertTrue(attempts.get() >= 3);
    }

    @Test
    @DisplayName("Should wait one interval before the first run")
    void initialDelay() throws InterruptedException {
        CountDownLatch ran = new CountDownLatch(1);

        scheduler.start(Duration.ofHours(1), Duration.ofHours(1), ran::countDown, ran::countDown);

        assertFalse(ran.await(200, TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("Start twice should fail, stop should allow a restart")
    void startStop() {
        scheduler.start(Duration.ofHours(1), Duration.ofHours(1), () -> { }, () -> { });

        assertThrows(IllegalStateException.class,
                () -> scheduler.start(Duration.ofHours(1), Duration.ofHours(1), () -> { }, () -> { }));

        scheduler.stop();
        scheduler.stop();

        assertDoesNotThrow(() -> scheduler.start(Duration.ofHours(1), Duration.ofHours(1), () -> { }, () -> { }));
    }

    @Test
    @DisplayName("stop() should let a run in progress finish without interrupting it")
    void stopLeavesRunInProgressAlone() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        AtomicInteger runs = new AtomicInteger();

        scheduler.start(Duration.ofMillis(10), Duration.ofHours(1), () -> {
            runs.incrementAndGet();
            started.countDown();
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                interrupted.set(true);
                Thread.currentThread().interrupt();
            } finally {
                finished.countDown();
            }
        }, () -> { });
        assertTrue(started.await(5, TimeUnit.SECONDS));

        long begin = System.nanoTime();
        scheduler.stop();
        long stopMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);

        assertTrue(stopMillis < 250, "stop() should not wait for the run, took " + stopMillis + "ms");
        assertTrue(finished.await(5, TimeUnit.SECONDS));
        assertFalse(interrupted.get(), "run in progress was interrupted");
        Thread.sleep(100);
        assertEquals(1, runs.get(), "no tick after stop");
    }
}
