package com.airbooking.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightSummary {

    LocalDate date;
    Long totalFlights;
    Double avgLoadFactor;
    Long cancelledFlights;
}
