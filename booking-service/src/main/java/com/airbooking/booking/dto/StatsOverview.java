package com.airbooking.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class StatsOverview {

    Long activeFlights;
    Long pendingReservations;
    BigDecimal totalRevenue;
    Long totalPassengers;
}
