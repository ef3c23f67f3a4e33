package com.airbooking.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class PaymentEntry {

    Long id;
    String referenceCode;
    Long reservationId;
    BigDecimal amount;
    String method;
    String settlementReference;
    String reservationStatus;
    LocalDateTime paidAt;
}
