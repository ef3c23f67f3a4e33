package com.airbooking.booking.exception;

/**
 * Operation refused because of the current state of related records, or because a
 * concurrent change could not be serialized.
 */
public class ConflictException extends BookingException {

    public ConflictException(String errorCode, String message) {
        super(errorCode, message);
    }

    public ConflictException(String errorCode, String message, boolean retryable) {
        super(errorCode, message, retryable);
    }

    public ConflictException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, true, cause);
    }

    public static ConflictException aircraftInUse(Long aircraftId) {
        return new ConflictException("AIRCRAFT_IN_USE",
                "Aircraft " + aircraftId + " is assigned to at least one flight");
    }

    public static ConflictException flightHasReservations(Long flightId) {
        return new ConflictException("FLIGHT_HAS_RESERVATIONS",
                "Flight " + flightId + " has reservations; cancel it instead");
    }

    public static ConflictException userHasReservations(Long userId) {
        return new ConflictException("USER_HAS_RESERVATIONS",
                "User " + userId + " has reservations");
    }

    public static ConflictException reservationTerminal(Long reservationId, Object status) {
        return new ConflictException("RESERVATION_TERMINAL",
                "Reservation " + reservationId + " is " + status + " and cannot be changed");
    }

    public static ConflictException illegalTransition(Long reservationId, Object from, Object to) {
        return new ConflictException("ILLEGAL_STATUS_TRANSITION",
                "Reservation " + reservationId + " cannot move from " + from + " to " + to);
    }

    public static ConflictException lockUnavailable(String resource) {
        return new ConflictException("LOCK_UNAVAILABLE",
                "Could not acquire lock for " + resource + ", please retry", true);
    }
}
