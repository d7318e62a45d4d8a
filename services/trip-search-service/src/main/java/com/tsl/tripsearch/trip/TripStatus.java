package com.tsl.tripsearch.trip;

import java.util.Locale;

public enum TripStatus {
    PLANNING,
    CONFIRMED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns null for blank or unrecognised values.
     */
    public static TripStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (TripStatus status : values()) {
            if (status.name().equals(normalized)) {
                return status;
            }
        }
        return null;
    }
}
