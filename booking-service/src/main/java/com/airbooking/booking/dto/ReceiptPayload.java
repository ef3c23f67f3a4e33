package com.airbooking.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Everything a receipt needs, captured at settlement time so delivery never reads the database.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ReceiptPayload {

    String referenceCode;
    Long reservationId;
    String payerName;
    String payerEmail;
    String route;
    Integer seats;
    LocalDateTime departureTime;
    BigDecimal subtotal;
    BigDecimal taxes;
    BigDecimal total;
    LocalDateTime paidAt;
}
