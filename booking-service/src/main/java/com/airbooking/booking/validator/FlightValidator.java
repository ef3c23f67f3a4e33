package com.airbooking.booking.validator;

import com.airbooking.booking.constants.ValidationMessages;
import com.airbooking.booking.exception.InvalidInputException;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public final class FlightValidator {

    private FlightValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void validateRoute(String origin, String destination) {
        if (origin == null || destination == null) {
            return; // Jakarta @NotBlank handles null checks
        }
        if (origin.trim().equalsIgnoreCase(destination.trim())) {
            throw new InvalidInputException(ValidationMessages.SAME_ORIGIN_DESTINATION);
        }
    }

    public static void validateSchedule(LocalDateTime departureTime, LocalDateTime arrivalTime) {
        if (departureTime == null || arrivalTime == null) {
            return;
        }
        if (!arrivalTime.isAfter(departureTime)) {
            throw new InvalidInputException(ValidationMessages.ARRIVAL_BEFORE_DEPARTURE);
        }
    }

    public static void validateFare(BigDecimal fare) {
        if (fare != null && fare.signum() < 0) {
            throw new InvalidInputException(ValidationMessages.FARE_NON_NEGATIVE);
        }
    }

    public static void validateCapacity(Integer capacity) {
        if (capacity == null || capacity <= 0) {
            throw new InvalidInputException("INVALID_CAPACITY", ValidationMessages.CAPACITY_POSITIVE);
        }
    }

    public static void validateSeatCount(Integer seats) {
        if (seats == null || seats <= 0) {
            throw new InvalidInputException("INVALID_SEATS", ValidationMessages.SEATS_MIN);
        }
    }
}
