package com.airbooking.booking.dto;

import com.airbooking.booking.constants.ValidationMessages;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ReservationRequest {

    @NotNull(message = ValidationMessages.FLIGHT_ID_REQUIRED)
    Long flightId;

    @NotNull(message = ValidationMessages.SEATS_REQUIRED)
    @Min(value = 1, message = ValidationMessages.SEATS_MIN)
    Integer seats;
}
