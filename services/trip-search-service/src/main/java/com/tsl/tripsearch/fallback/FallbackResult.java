package com.tsl.tripsearch.fallback;

import java.util.List;

public record FallbackResult<T>(
    FallbackTier tier,
    String strategy,
    List<T> rows,
    String message,
    String suggestion,
    List<FallbackAttempt> attempts
) {
    public FallbackResult {
        rows = List.copyOf(rows);
        attempts = List.copyOf(attempts);
    }

    public static <T> FallbackResult<T> success(
        FallbackTier tier,
        String strategy,
        List<T> rows,
        List<FallbackAttempt> attempts
    ) {
        return new FallbackResult<>(tier, strategy, rows, null, null, attempts);
    }

    public static <T> FallbackResult<T> exhausted(String message, String suggestion, List<FallbackAttempt> attempts) {
        return new FallbackResult<>(FallbackTier.EXHAUSTED, null, List.of(), message, suggestion, attempts);
    }

    public boolean isExhausted() {
        return tier == FallbackTier.EXHAUSTED;
    }
}
