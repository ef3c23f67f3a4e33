package com.airbooking.booking.model.converter;

import com.airbooking.booking.enums.ReservationStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class ReservationStatusConverter implements AttributeConverter<ReservationStatus, String> {

    @Override
    public String convertToDatabaseColumn(ReservationStatus status) {
        return status != null ? status.name() : null;
    }

    @Override
    public ReservationStatus convertToEntityAttribute(String column) {
        return ReservationStatus.fromLabel(column);
    }
}
