package com.airbooking.booking.mapper;

import com.airbooking.booking.dto.PaymentEntry;
import com.airbooking.booking.model.Payment;

public final class PaymentMapper {

    private PaymentMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static PaymentEntry toEntry(Payment payment) {
        if (payment == null) {
            return null;
        }

        return PaymentEntry.builder()
                .id(payment.getId())
                .referenceCode(payment.getReferenceCode())
                .reservationId(payment.getReservation() != null ? payment.getReservation().getId() : null)
                .amount(payment.getAmount())
                .method(payment.getPaymentMethod() != null ? payment.getPaymentMethod().getLabel() : null)
                .settlementReference(payment.getSettlementReference())
                .reservationStatus(payment.getReservation() != null && payment.getReservation().getStatus() != null
                        ? payment.getReservation().getStatus().name() : null)
                .paidAt(payment.getPaidAt())
                .build();
    }
}
