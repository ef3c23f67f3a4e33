package com.airbooking.booking.dto;

import com.airbooking.booking.constants.ValidationMessages;
import com.airbooking.booking.enums.ReservationStatus;
import jakarta.validation.constraints.Min;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ReservationUpdateRequest {

    @Min(value = 1, message = ValidationMessages.SEATS_MIN)
    Integer seats;

    ReservationStatus status;
}
