package com.airbooking.booking.model.converter;

import com.airbooking.booking.enums.FlightStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Reads historical spellings of the flight status column, always writes the canonical name.
 */
@Converter(autoApply = true)
public class FlightStatusConverter implements AttributeConverter<FlightStatus, String> {

    @Override
    public String convertToDatabaseColumn(FlightStatus status) {
        return status != null ? status.name() : null;
    }

    @Override
    public FlightStatus convertToEntityAttribute(String column) {
        return FlightStatus.fromLabel(column);
    }
}
