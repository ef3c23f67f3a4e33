package com.airbooking.booking.exception;

import lombok.Getter;

/**
 * Seat request larger than what is left on the flight. Carries the remaining count
 * observed under the flight lock at rejection time.
 */
@Getter
public class CapacityExceededException extends BookingException {

    private static final String ERROR_CODE = "CAPACITY_EXCEEDED";

    private final Long flightId;
    private final int requestedSeats;
    private final int remainingSeats;

    public CapacityExceededException(Long flightId, int requestedSeats, int remainingSeats) {
        super(ERROR_CODE, String.format("Insufficient capacity on flight %d: requested %d, remaining %d",
                flightId, requestedSeats, remainingSeats));
        this.flightId = flightId;
        this.requestedSeats = requestedSeats;
        this.remainingSeats = remainingSeats;
    }
}
