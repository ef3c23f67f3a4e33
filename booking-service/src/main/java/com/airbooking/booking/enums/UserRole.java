package com.airbooking.booking.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.airbooking.booking.util.StatusLabels;

import java.util.Map;

public enum UserRole {
    CLIENT,
    AGENT,
    ADMIN;

    private static final Map<String, UserRole> LEGACY_LABELS = Map.of(
            "client", CLIENT,
            "agent", AGENT,
            "admin", ADMIN);

    public boolean hasAgentCapability() {
        return this == AGENT || this == ADMIN;
    }

    @JsonCreator
    public static UserRole fromLabel(String label) {
        return StatusLabels.resolve(label, UserRole.class, LEGACY_LABELS);
    }
}
