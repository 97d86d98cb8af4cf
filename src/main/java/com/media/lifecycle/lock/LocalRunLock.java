package com.media.lifecycle.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process {@link RunLock} backed by one {@link ReentrantLock} per key.
 * Suitable for a single engine per JVM.
 */
public class LocalRunLock implements RunLock {
    private static final Logger log = LoggerFactory.getLogger(LocalRunLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalRunLock() {
        this(LockConfig.defaults());
    }

    public LocalRunLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String key) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        if (lock.isHeldByCurrentThread()) {
            log.debug("Lock already held by this thread: {}", key);
            return false;
        }
        boolean acquired;
        if (config.waitTimeoutMs() == 0) {
            acquired = lock.tryLock();
        } else {
            try {
                acquired = lock.tryLock(config.waitTimeoutMs(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        if (acquired) {
            log.debug("Lock acquired: {}", key);
        }
        return acquired;
    }

    @Override
    public void unlock(String key) {
        ReentrantLock lock = locks.get(key);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("Lock released: {}", key);
        }
    }

    @Override
    public boolean isLocked(String key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isLocked();
    }
}
