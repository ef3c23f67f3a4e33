package com.airbooking.booking.exception;

/**
 * Thrown when a referenced aircraft, flight, reservation, payment or user does not exist.
 */
public class ResourceNotFoundException extends BookingException {

    private ResourceNotFoundException(String errorCode, String message) {
        super(errorCode, message);
    }

    public static ResourceNotFoundException aircraft(Long aircraftId) {
        return new ResourceNotFoundException("AIRCRAFT_NOT_FOUND", "Aircraft not found: " + aircraftId);
    }

    public static ResourceNotFoundException flight(Long flightId) {
        return new ResourceNotFoundException("FLIGHT_NOT_FOUND", "Flight not found: " + flightId);
    }

    public static ResourceNotFoundException reservation(Long reservationId) {
        return new ResourceNotFoundException("RESERVATION_NOT_FOUND", "Reservation not found: " + reservationId);
    }

    public static ResourceNotFoundException payment(Long reservationId) {
        return new ResourceNotFoundException("PAYMENT_NOT_FOUND", "No payment for reservation: " + reservationId);
    }

    public static ResourceNotFoundException user(Long userId) {
        return new ResourceNotFoundException("USER_NOT_FOUND", "User not found: " + userId);
    }
}
