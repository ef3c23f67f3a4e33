package com.airbooking.booking.model.converter;

import com.airbooking.booking.enums.AircraftStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class AircraftStatusConverter implements AttributeConverter<AircraftStatus, String> {

    @Override
    public String convertToDatabaseColumn(AircraftStatus status) {
        return status != null ? status.name() : null;
    }

    @Override
    public AircraftStatus convertToEntityAttribute(String column) {
        return AircraftStatus.fromLabel(column);
    }
}
