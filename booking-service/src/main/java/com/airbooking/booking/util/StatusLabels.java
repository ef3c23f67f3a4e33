package com.airbooking.booking.util;

import com.airbooking.booking.exception.InvalidInputException;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Map;

/**
 * Maps free-form status labels from requests or legacy rows onto the closed enum sets.
 * Matching is case-insensitive and ignores accents, so "Annulée" and "ANNULEE" resolve alike.
 */
public final class StatusLabels {

    private StatusLabels() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static <E extends Enum<E>> E resolve(String label, Class<E> type, Map<String, E> legacyLabels) {
        if (label == null || label.isBlank()) {
            return null;
        }
        String key = normalize(label);
        E legacy = legacyLabels.get(key);
        if (legacy != null) {
            return legacy;
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equalsIgnoreCase(key)) {
                return constant;
            }
        }
        throw new InvalidInputException("INVALID_STATUS",
                "Unknown " + type.getSimpleName() + " value: " + label);
    }

    public static String normalize(String label) {
        String stripped = Normalizer.normalize(label.trim(), Normalizer.Form.NFD)
                .replaceAll("\\p{M}", "");
        return stripped.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
