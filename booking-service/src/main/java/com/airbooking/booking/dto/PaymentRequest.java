package com.airbooking.booking.dto;

import com.airbooking.booking.constants.BookingConstants;
import com.airbooking.booking.constants.ValidationMessages;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class PaymentRequest {

    @NotNull(message = ValidationMessages.RESERVATION_ID_REQUIRED)
    Long reservationId;

    @NotBlank(message = ValidationMessages.PHONE_REQUIRED)
    @Pattern(regexp = BookingConstants.SETTLEMENT_PHONE_PATTERN, message = ValidationMessages.PHONE_FORMAT)
    String phoneNumber;
}
