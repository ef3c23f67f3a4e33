package com.airbooking.booking.exception;

public class UnauthorizedException extends BookingException {

    private static final String ERROR_CODE = "UNAUTHENTICATED";

    public UnauthorizedException(String message) {
        super(ERROR_CODE, message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
