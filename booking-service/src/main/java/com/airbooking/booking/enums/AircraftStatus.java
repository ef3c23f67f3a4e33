package com.airbooking.booking.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.airbooking.booking.util.StatusLabels;

import java.util.Map;

public enum AircraftStatus {
    AVAILABLE,
    UNAVAILABLE,
    BLOCKED;

    private static final Map<String, AircraftStatus> LEGACY_LABELS = Map.ofEntries(
            Map.entry("disponible", AVAILABLE),
            Map.entry("available", AVAILABLE),
            Map.entry("indisponible", UNAVAILABLE),
            Map.entry("unavailable", UNAVAILABLE),
            Map.entry("maintenance", UNAVAILABLE),
            Map.entry("bloque", BLOCKED),
            Map.entry("blocked", BLOCKED));

    public boolean isAvailable() {
        return this == AVAILABLE;
    }

    @JsonCreator
    public static AircraftStatus fromLabel(String label) {
        return StatusLabels.resolve(label, AircraftStatus.class, LEGACY_LABELS);
    }
}
