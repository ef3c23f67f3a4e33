package com.airbooking.booking.service.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

@Service
@ConditionalOnProperty(name = "booking.lock.provider", havingValue = "redis", matchIfMissing = true)
@Slf4j
public class DistributedLockService implements LockOperations {

    private static final String LOCK_KEY_PREFIX = "lock:";
    private static final long RETRY_DELAY_MS = 50;

    private static final String RELEASE_LOCK_SCRIPT = "if redis.call('GET', KEYS[1]) == ARGV[1] then " +
            "return redis.call('DEL', KEYS[1]) " +
            "else return 0 end";

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT =
            new DefaultRedisScript<>(RELEASE_LOCK_SCRIPT, Long.class);

    private final StringRedisTemplate stringRedisTemplate;
    private final Duration leaseTime;
    private final Duration waitTime;

    public DistributedLockService(StringRedisTemplate stringRedisTemplate,
                                  @Value("${booking.lock.lease-ms:10000}") long leaseMs,
                                  @Value("${booking.lock.wait-ms:5000}") long waitMs) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.leaseTime = Duration.ofMillis(leaseMs);
        this.waitTime = Duration.ofMillis(waitMs);
    }

    public LockHandle acquireLock(String resourceId) {
        String lockKey = LOCK_KEY_PREFIX + resourceId;
        String lockValue = UUID.randomUUID().toString();
        long deadline = System.currentTimeMillis() + waitTime.toMillis();

        while (System.currentTimeMillis() < deadline) {
            Boolean acquired = stringRedisTemplate.opsForValue()
                    .setIfAbsent(lockKey, lockValue, leaseTime.toMillis(), TimeUnit.MILLISECONDS);

            if (Boolean.TRUE.equals(acquired)) {
                log.debug("Acquired lock: resource={}, lockKey={}", resourceId, lockKey);
                return new LockHandle(lockKey, lockValue, true);
            }

            try {
                Thread.sleep(RETRY_DELAY_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Lock acquisition interrupted: resource={}", resourceId);
                return new LockHandle(lockKey, lockValue, false);
            }
        }

        log.warn("Failed to acquire lock within timeout: resource={}, waitTimeout={}ms",
                resourceId, waitTime.toMillis());
        return new LockHandle(lockKey, lockValue, false);
    }

    public void releaseLock(LockHandle handle) {
        if (handle == null || !handle.isAcquired()) {
            return;
        }

        Long result = stringRedisTemplate.execute(RELEASE_SCRIPT,
                Collections.singletonList(handle.getLockKey()),
                handle.getLockValue());

        if (result != null && result == 1L) {
            log.debug("Released lock: lockKey={}", handle.getLockKey());
        } else {
            log.warn("Lock release failed (expired or stolen): lockKey={}", handle.getLockKey());
        }
    }

    @Override
    public <T> T executeWithLock(String resourceId, Supplier<T> action) {
        LockHandle handle = acquireLock(resourceId);
        if (!handle.isAcquired()) {
            throw new LockAcquisitionException("Failed to acquire lock for " + resourceId);
        }

        try {
            return action.get();
        } finally {
            releaseLock(handle);
        }
    }

    @lombok.Value
    public static class LockHandle {
        String lockKey;
        String lockValue;
        boolean acquired;
    }
}
