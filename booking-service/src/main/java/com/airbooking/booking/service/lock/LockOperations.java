package com.airbooking.booking.service.lock;

import java.util.function.Supplier;

/**
 * Mutual exclusion around a named resource, such as every seat change on one flight.
 * Implementations: Redis for multi-instance deployments, in-JVM for a single node and tests.
 */
public interface LockOperations {

    /**
     * Executes action while holding the lock on the resource.
     *
     * @param resourceId Resource to lock
     * @param action Action to execute while holding lock
     * @return Result of action
     * @throws LockAcquisitionException if the lock cannot be acquired within the wait timeout
     */
    <T> T executeWithLock(String resourceId, Supplier<T> action);

    class LockAcquisitionException extends RuntimeException {
        public LockAcquisitionException(String message) {
            super(message);
        }
    }
}
