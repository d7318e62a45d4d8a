package com.tsl.tripsearch.fallback;

import java.util.List;
import java.util.function.Supplier;

/**
 * One query attempt inside a tier. The supplier runs the query and may throw the store's exceptions.
 */
public record FallbackStep<T>(FallbackTier tier, String strategy, Supplier<List<T>> query) {
    public FallbackStep {
        if (tier == FallbackTier.EXHAUSTED) {
            throw new IllegalArgumentException("The exhausted tier cannot run queries");
        }
    }
}
