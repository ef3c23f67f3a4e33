package com.airbooking.booking.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.airbooking.booking.util.StatusLabels;

import java.util.Map;

public enum FlightStatus {
    ACTIVE,
    CANCELLED,
    BLOCKED;

    // Spellings found in historical data for the same three states
    private static final Map<String, FlightStatus> LEGACY_LABELS = Map.ofEntries(
            Map.entry("actif", ACTIVE),
            Map.entry("active", ACTIVE),
            Map.entry("annule", CANCELLED),
            Map.entry("annulee", CANCELLED),
            Map.entry("cancelled", CANCELLED),
            Map.entry("canceled", CANCELLED),
            Map.entry("bloque", BLOCKED),
            Map.entry("bloquee", BLOCKED),
            Map.entry("blocked", BLOCKED));

    @JsonCreator
    public static FlightStatus fromLabel(String label) {
        return StatusLabels.resolve(label, FlightStatus.class, LEGACY_LABELS);
    }
}
