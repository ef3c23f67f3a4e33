package com.airbooking.booking.dto;

import com.airbooking.booking.constants.ValidationMessages;
import com.airbooking.booking.enums.AircraftStatus;
import jakarta.validation.constraints.Min;
import lombok.*;
import lombok.experimental.FieldDefaults;

/**
 * Partial update, null fields are left untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class AircraftUpdateRequest {

    String model;

    @Min(value = 1, message = ValidationMessages.CAPACITY_POSITIVE)
    Integer capacity;

    AircraftStatus status;

    String airline;
}
