package com.airbooking.booking.service.cache;

import com.airbooking.booking.enums.FlightStatus;
import com.airbooking.booking.model.Flight;
import com.airbooking.booking.repository.FlightRepository;
import com.airbooking.booking.service.CapacityLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Rebuilds the seat cache from the ledger at startup and periodically, repairing any drift
 * left by failed cache writes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SeatCacheSynchronizer {

    private final FlightRepository flightRepository;
    private final CapacityLedger capacityLedger;
    private final SeatCacheService seatCacheService;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        syncAllFromDb();
    }

    @Scheduled(fixedDelayString = "${booking.seat-cache.resync-interval-ms:60000}",
            initialDelayString = "${booking.seat-cache.resync-interval-ms:60000}")
    public void scheduledResync() {
        syncAllFromDb();
    }

    public int syncAllFromDb() {
        if (!seatCacheService.isEnabled()) {
            return 0;
        }

        List<Flight> flights = flightRepository.findWithAircraftByStatus(FlightStatus.ACTIVE);
        Map<Long, Integer> occupied = capacityLedger.occupiedSeatsByFlight(
                flights.stream().map(Flight::getId).toList());

        int count = 0;
        for (Flight flight : flights) {
            try {
                int capacity = capacityLedger.capacityOf(flight);
                seatCacheService.setSeats(flight.getId(), capacity - occupied.getOrDefault(flight.getId(), 0));
                count++;
            } catch (Exception e) {
                log.error("Failed to sync flight {}: {}", flight.getId(), e.getMessage());
            }
        }

        log.info("Synced {} flights from DB to seat cache", count);
        return count;
    }
}
