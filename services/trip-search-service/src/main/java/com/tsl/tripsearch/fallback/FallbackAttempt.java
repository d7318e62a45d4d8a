package com.tsl.tripsearch.fallback;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public record FallbackAttempt(FallbackTier tier, String strategy, Outcome outcome, long tookMs) {

    public enum Outcome {
        SUCCESS,
        EMPTY,
        TOO_COMPLEX;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
