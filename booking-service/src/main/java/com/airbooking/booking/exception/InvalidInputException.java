package com.airbooking.booking.exception;

public class InvalidInputException extends BookingException {

    private static final String ERROR_CODE = "INVALID_INPUT";

    public InvalidInputException(String message) {
        super(ERROR_CODE, message);
    }

    public InvalidInputException(String errorCode, String message) {
        super(errorCode, message);
    }
}
