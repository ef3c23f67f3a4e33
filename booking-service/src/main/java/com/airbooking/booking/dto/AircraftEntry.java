package com.airbooking.booking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AircraftEntry {

    Long id;
    String model;
    Integer capacity;
    String status;
    String airline;
    Long flightCount;
    LocalDateTime createdAt;
}
