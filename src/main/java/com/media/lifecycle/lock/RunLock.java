package com.media.lifecycle.lock;

/**
 * Admits at most one holder per key. Used to keep reconciliation runs from overlapping.
 */
public interface RunLock {

    /**
     * Attempts to acquire the lock for the key.
     *
     * @return true if acquired, false if another holder has it
     */
    boolean tryLock(String key);

    /**
     * Releases the lock for the key if the current thread holds it.
     */
    void unlock(String key);

    /**
     * Returns true if any thread currently holds the lock for the key.
     */
    boolean isLocked(String key);
}
