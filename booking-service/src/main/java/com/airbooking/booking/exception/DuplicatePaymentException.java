package com.airbooking.booking.exception;

import lombok.Getter;

@Getter
public class DuplicatePaymentException extends BookingException {

    private static final String ERROR_CODE = "DUPLICATE_PAYMENT";

    private final Long reservationId;

    public DuplicatePaymentException(Long reservationId) {
        super(ERROR_CODE, "Payment already recorded for reservation: " + reservationId);
        this.reservationId = reservationId;
    }
}
