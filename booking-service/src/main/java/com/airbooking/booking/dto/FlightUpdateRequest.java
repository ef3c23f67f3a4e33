package com.airbooking.booking.dto;

import com.airbooking.booking.constants.ValidationMessages;
import com.airbooking.booking.enums.FlightStatus;
import jakarta.validation.constraints.DecimalMin;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Partial update, null fields are left untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightUpdateRequest {

    String origin;
    String destination;
    LocalDateTime departureTime;
    LocalDateTime arrivalTime;

    @DecimalMin(value = "0.00", message = ValidationMessages.FARE_NON_NEGATIVE)
    BigDecimal fare;

    FlightStatus status;
    Long aircraftId;
}
