package com.airbooking.booking.service.cache;

import com.airbooking.booking.constants.BookingConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Optional;

/**
 * Redis copy of each flight's remaining seats, written after every committed seat change.
 * Search reads it; capacity decisions never do. All Redis failures are logged and swallowed
 * so the cache can never fail a booking.
 */
@Service
@Slf4j
public class SeatCacheService {

    private final RedisTemplate<String, Object> redisTemplate;
    private final boolean enabled;

    public SeatCacheService(RedisTemplate<String, Object> redisTemplate,
                            @Value("${booking.seat-cache.enabled:true}") boolean enabled) {
        this.redisTemplate = redisTemplate;
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setSeats(Long flightId, int seats) {
        if (!enabled) {
            return;
        }
        String key = formatSeatsKey(flightId);
        try {
            redisTemplate.opsForValue().set(key, seats);
            log.debug("Set seats: flightId={}, seats={}", flightId, seats);
        } catch (Exception e) {
            log.error("Failed to set seats for flight {}: {}", flightId, e.getMessage());
        }
    }

    public Optional<Integer> getSeats(Long flightId) {
        if (!enabled) {
            return Optional.empty();
        }
        String key = formatSeatsKey(flightId);
        try {
            Object value = redisTemplate.opsForValue().get(key);
            if (value != null) {
                return Optional.of(Integer.parseInt(value.toString()));
            }
        } catch (Exception e) {
            log.warn("Failed to get seats for flight {}: {}", flightId, e.getMessage());
        }
        return Optional.empty();
    }

    public void deleteSeats(Long flightId) {
        if (!enabled) {
            return;
        }
        String key = formatSeatsKey(flightId);
        try {
            redisTemplate.delete(key);
            log.debug("Deleted seats key: flightId={}", flightId);
        } catch (Exception e) {
            log.warn("Failed to delete seats for flight {}: {}", flightId, e.getMessage());
        }
    }

    /**
     * Writes the value once the surrounding transaction commits, or immediately when there is none.
     * A null value evicts the key.
     */
    public void refreshAfterCommit(Long flightId, Integer seats) {
        Runnable write = () -> {
            if (seats == null) {
                deleteSeats(flightId);
            } else {
                setSeats(flightId, seats);
            }
        };
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    write.run();
                }
            });
        } else {
            write.run();
        }
    }

    public String formatSeatsKey(Long flightId) {
        return BookingConstants.REDIS_AVAILABLE_SEATS_PREFIX + flightId + BookingConstants.REDIS_AVAILABLE_SEATS_SUFFIX;
    }
}
