package com.airbooking.booking.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.airbooking.booking.util.StatusLabels;

import java.util.Map;

/**
 * Lifecycle of a reservation.
 * PAID and CANCELLED are terminal with respect to seat changes; CANCELLED is never left.
 */
public enum ReservationStatus {
    PENDING,
    CONFIRMED,
    PAID,
    CANCELLED;

    private static final Map<String, ReservationStatus> LEGACY_LABELS = Map.ofEntries(
            Map.entry("en_attente", PENDING),
            Map.entry("pending", PENDING),
            Map.entry("confirmee", CONFIRMED),
            Map.entry("confirmed", CONFIRMED),
            Map.entry("paye", PAID),
            Map.entry("paid", PAID),
            Map.entry("annulee", CANCELLED),
            Map.entry("annule", CANCELLED),
            Map.entry("cancelled", CANCELLED),
            Map.entry("canceled", CANCELLED));

    public boolean isTerminal() {
        return this == PAID || this == CANCELLED;
    }

    public boolean allowsSeatChange() {
        return !isTerminal();
    }

    /**
     * Back-office status override rules. PAID is only reachable through settlement and a
     * reservation never moves back to PENDING.
     */
    public boolean canMoveTo(ReservationStatus target) {
        if (target == null || target == this) {
            return true;
        }
        if (this == CANCELLED) {
            return false;
        }
        if (target == CANCELLED) {
            return true;
        }
        return this == PENDING && target == CONFIRMED;
    }

    public boolean isPayable() {
        return this == PENDING || this == CONFIRMED;
    }

    @JsonCreator
    public static ReservationStatus fromLabel(String label) {
        return StatusLabels.resolve(label, ReservationStatus.class, LEGACY_LABELS);
    }
}
