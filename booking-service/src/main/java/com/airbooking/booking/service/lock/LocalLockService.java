package com.airbooking.booking.service.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-resource fair locks held in this JVM. Only correct when a single instance serves the database.
 * An entry lives only while some thread holds or waits for it.
 */
@Service
@ConditionalOnProperty(name = "booking.lock.provider", havingValue = "local")
@Slf4j
public class LocalLockService implements LockOperations {

    private final ConcurrentMap<String, LockEntry> locks = new ConcurrentHashMap<>();
    private final long waitMs;

    public LocalLockService(@Value("${booking.lock.wait-ms:5000}") long waitMs) {
        this.waitMs = waitMs;
    }

    @Override
    public <T> T executeWithLock(String resourceId, Supplier<T> action) {
        LockEntry entry = retain(resourceId);
        try {
            boolean acquired;
            try {
                acquired = entry.lock.tryLock(waitMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockAcquisitionException("Interrupted while waiting for lock on " + resourceId);
            }
            if (!acquired) {
                log.warn("Failed to acquire local lock within timeout: resource={}, waitTimeout={}ms",
                        resourceId, waitMs);
                throw new LockAcquisitionException("Failed to acquire lock for " + resourceId);
            }

            log.debug("Acquired local lock: resource={}", resourceId);
            try {
                return action.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            release(resourceId);
        }
    }

    int trackedResources() {
        return locks.size();
    }

    private LockEntry retain(String resourceId) {
        return locks.compute(resourceId, (key, entry) -> {
            LockEntry current = entry != null ? entry : new LockEntry();
            current.users++;
            return current;
        });
    }

    private void release(String resourceId) {
        locks.computeIfPresent(resourceId, (key, entry) -> --entry.users == 0 ? null : entry);
    }

    // users is only touched inside compute, which serialises access per key
    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
