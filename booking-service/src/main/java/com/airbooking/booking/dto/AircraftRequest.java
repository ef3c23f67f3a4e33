package com.airbooking.booking.dto;

import com.airbooking.booking.constants.ValidationMessages;
import com.airbooking.booking.enums.AircraftStatus;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class AircraftRequest {

    @NotBlank(message = ValidationMessages.MODEL_REQUIRED)
    String model;

    @NotNull(message = ValidationMessages.CAPACITY_REQUIRED)
    @Min(value = 1, message = ValidationMessages.CAPACITY_POSITIVE)
    Integer capacity;

    @Builder.Default
    AircraftStatus status = AircraftStatus.AVAILABLE;

    String airline;
}
