package com.media.lifecycle.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LocalRunLock Tests")
class LocalRunLockTest {

    @Test
    @DisplayName("Should acquire and release a free key")
    void acquireRelease() {
        LocalRunLock lock = new LocalRunLock();

        assertTrue(lock.tryLock("run"));
        assertTrue(lock.isLocked("run"));
        lock.unlock("run");
        assertFalse(lock.isLocked("run"));
    }

    @Test
    @DisplayName("Re-entry from the holding thread should be rejected")
    void rejectsReentry() {
        LocalRunLock lock = new LocalRunLock();
        assertTrue(lock.tryLock("run"));

        assertFalse(lock.tryLock("run"));
        lock.unlock("run");
    }

    @Test
    @DisplayName("Another thread should not acquire a held key")
    void otherThreadRejected() throws Exception {
        LocalRunLock lock = new LocalRunLock();
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<Void> holder = CompletableFuture.runAsync(() -> {
            lock.tryLock("run");
            held.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                lock.unlock("run");
            }
        });

        assertTrue(held.await(5, TimeUnit.SECONDS));
        assertFalse(lock.tryLock("run"));
        assertTrue(lock.tryLock("other"), "keys are independent");
        lock.unlock("other");

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        assertTrue(lock.tryLock("run"));
        lock.unlock("run");
    }

    @Test
    @DisplayName("Unlocking a key that is not held should do nothing")
    void unlockNotHeld() {
        LocalRunLock lock = new LocalRunLock();
        assertDoesNotThrow(() -> lock.unlock("never-locked"));
    }
}
