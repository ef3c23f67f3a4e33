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
public class RecentReservationEntry {

    Long id;
    String passengerName;
    String initials;
    String flightCode;
    Integer seats;
    String status;
    BigDecimal amount;
    LocalDateTime createdAt;
}
