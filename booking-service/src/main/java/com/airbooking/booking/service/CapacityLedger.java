package com.airbooking.booking.service;

import com.airbooking.booking.constants.BookingConstants;
import com.airbooking.booking.exception.InvalidInputException;
import com.airbooking.booking.model.Aircraft;
import com.airbooking.booking.model.Flight;
import com.airbooking.booking.repository.ReservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Seats committed to a flight are the sum over its reservations that are not cancelled.
 * Callers that act on the result must hold the flight's row lock in the same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CapacityLedger {

    private static final List<String> RELEASED_LABELS = BookingConstants.CANCELLED_RESERVATION_LABELS;

    private final ReservationRepository reservationRepository;

    public int occupiedSeats(Long flightId) {
        return occupiedSeats(flightId, null);
    }

    public int occupiedSeats(Long flightId, Long excludedReservationId) {
        Number taken = excludedReservationId == null
                ? reservationRepository.sumSeatsByFlight(flightId, RELEASED_LABELS)
                : reservationRepository.sumSeatsByFlightExcluding(flightId, excludedReservationId, RELEASED_LABELS);
        return taken == null ? 0 : Math.toIntExact(taken.longValue());
    }

    public int remainingSeats(Flight flight) {
        return remainingSeats(flight, null);
    }

    public int remainingSeats(Flight flight, Long excludedReservationId) {
        int capacity = capacityOf(flight);
        int remaining = capacity - occupiedSeats(flight.getId(), excludedReservationId);
        log.debug("Ledger: flightId={}, capacity={}, remaining={}, excluded={}",
                flight.getId(), capacity, remaining, excludedReservationId);
        return remaining;
    }

    /**
     * Remaining seats, or null when the flight's capacity is not usable. For callers that only
     * report the figure and must not fail because of it.
     */
    public Integer knownRemainingSeats(Flight flight) {
        Aircraft aircraft = flight.getAircraft();
        if (aircraft == null || !aircraft.hasUsableCapacity()) {
            return null;
        }
        return aircraft.getCapacity() - occupiedSeats(flight.getId());
    }

    /**
     * @throws InvalidInputException when the flight has no aircraft or a non-positive capacity
     */
    public int capacityOf(Flight flight) {
        Aircraft aircraft = flight.getAircraft();
        if (aircraft == null || !aircraft.hasUsableCapacity()) {
            log.error("Flight {} has no usable aircraft capacity, refusing seat operation", flight.getId());
            throw new InvalidInputException("INVALID_CAPACITY",
                    "Aircraft capacity is not configured for flight " + flight.getId());
        }
        return aircraft.getCapacity();
    }

    public Map<Long, Integer> occupiedSeatsByFlight(Collection<Long> flightIds) {
        Map<Long, Integer> occupied = new HashMap<>();
        if (flightIds == null || flightIds.isEmpty()) {
            return occupied;
        }
        for (Object[] row : reservationRepository.sumSeatsByFlights(flightIds, RELEASED_LABELS)) {
            occupied.put(((Number) row[0]).longValue(), ((Number) row[1]).intValue());
        }
        return occupied;
    }
}
