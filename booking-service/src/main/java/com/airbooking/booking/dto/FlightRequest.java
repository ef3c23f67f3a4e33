package com.airbooking.booking.dto;

import com.airbooking.booking.constants.ValidationMessages;
import com.airbooking.booking.enums.FlightStatus;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightRequest {

    @NotBlank(message = ValidationMessages.ORIGIN_REQUIRED)
    String origin;

    @NotBlank(message = ValidationMessages.DESTINATION_REQUIRED)
    String destination;

    @NotNull(message = ValidationMessages.DEPARTURE_REQUIRED)
    LocalDateTime departureTime;

    LocalDateTime arrivalTime;

    @NotNull(message = ValidationMessages.FARE_REQUIRED)
    @DecimalMin(value = "0.00", message = ValidationMessages.FARE_NON_NEGATIVE)
    BigDecimal fare;

    @Builder.Default
    FlightStatus status = FlightStatus.ACTIVE;

    @NotNull(message = ValidationMessages.AIRCRAFT_ID_REQUIRED)
    Long aircraftId;
}
