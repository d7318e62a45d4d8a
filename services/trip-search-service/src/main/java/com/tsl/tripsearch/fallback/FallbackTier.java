package com.tsl.tripsearch.fallback;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum FallbackTier {
    PRIMARY,
    SECONDARY,
    EMERGENCY,
    EXHAUSTED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
