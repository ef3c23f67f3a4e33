package com.airbooking.booking.exception;

public class ForbiddenException extends BookingException {

    private static final String ERROR_CODE = "FORBIDDEN";

    public ForbiddenException(String message) {
        super(ERROR_CODE, message);
    }
}
