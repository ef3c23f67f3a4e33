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
public class FlightBoardEntry {

    Long id;
    String flightCode;
    String origin;
    String destination;
    LocalDateTime departureTime;
    LocalDateTime arrivalTime;
    BigDecimal fare;
    String status;
    String aircraftModel;
    Integer aircraftCapacity;
    Integer seatsBooked;
    Double loadFactor;
}
