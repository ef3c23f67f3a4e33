package com.airbooking.booking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReservationEntry {

    Long id;
    Long userId;
    String userName;
    Long flightId;
    String origin;
    String destination;
    LocalDateTime departureTime;
    Integer seats;
    BigDecimal serviceFee;
    BigDecimal totalAmount;
    String status;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;
}
