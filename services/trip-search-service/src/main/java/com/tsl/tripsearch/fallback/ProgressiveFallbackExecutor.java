package com.tsl.tripsearch.fallback;

import com.tsl.tripsearch.config.TripSearchProperties;
import com.tsl.tripsearch.query.SearchVocabulary;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs query steps in tier order and returns the first non-empty result.
 *
 * <p>A step that the store rejects as too complex or timed out, or that returns no rows, hands over to the next
 * step. Any other failure propagates unchanged. When every step is used up the result is tagged
 * {@link FallbackTier#EXHAUSTED} and carries a suggestion instead of rows.
 */
@Component
public class ProgressiveFallbackExecutor {
    private static final Logger logger = LoggerFactory.getLogger(ProgressiveFallbackExecutor.class);
    private static final String NO_RESULTS_SUGGESTION =
        "Use specific trip names, client names or emails, or single keywords like \"planning\" or \"confirmed\".";

    private final MeterRegistry meterRegistry;
    private final long nearTimeoutMs;

    public ProgressiveFallbackExecutor(TripSearchProperties properties, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.nearTimeoutMs = properties.getFallback().getNearTimeoutMs();
    }

    public <T> FallbackResult<T> execute(String query, List<FallbackStep<T>> steps) {
        List<FallbackAttempt> attempts = new ArrayList<>();
        for (FallbackStep<T> step : steps) {
            long started = System.nanoTime();
            try {
                List<T> rows = step.query().get();
                long tookMs = elapsedMs(started);
                warnIfSlow(step, tookMs);
                if (rows != null && !rows.isEmpty()) {
                    attempts.add(record(step, FallbackAttempt.Outcome.SUCCESS, tookMs));
                    if (step.tier() != FallbackTier.PRIMARY) {
                        logger.info("search degraded to tier={} strategy={} rows={}", step.tier().label(), step.strategy(), rows.size());
                    }
                    return FallbackResult.success(step.tier(), step.strategy(), rows, attempts);
                }
                attempts.add(record(step, FallbackAttempt.Outcome.EMPTY, tookMs));
                logger.debug("tier={} strategy={} returned no rows", step.tier().label(), step.strategy());
            } catch (RuntimeException ex) {
                if (!EngineErrors.isComplexityError(ex)) {
                    throw ex;
                }
                long tookMs = elapsedMs(started);
                attempts.add(record(step, FallbackAttempt.Outcome.TOO_COMPLEX, tookMs));
                logger.warn("tier={} strategy={} rejected by store after {}ms: {}",
                    step.tier().label(), step.strategy(), tookMs, ex.getMessage());
            }
        }
        meterRegistry.counter("ts_fallback_exhausted_total").increment();
        String message = "No results found for \"" + (query == null ? "" : query.trim()) + "\".";
        return FallbackResult.exhausted(message, NO_RESULTS_SUGGESTION, attempts);
    }

    /**
     * Picks the single most meaningful word of a query, skipping command words such as "show" or "find".
     */
    public static String primaryTerm(String query) {
        if (query == null || query.isBlank()) {
            return "";
        }
        String[] words = query.trim().toLowerCase(Locale.ROOT).split("\\s+");
        for (String word : words) {
            String cleaned = word.replaceAll("[^\\p{L}\\p{N}@._-]", "");
            if (cleaned.length() < 2) {
                continue;
            }
            if (SearchVocabulary.IMPERATIVE_WORDS.contains(cleaned) || SearchVocabulary.STOP_WORDS.contains(cleaned)) {
                continue;
            }
            return cleaned;
        }
        String first = words[0].replaceAll("[^\\p{L}\\p{N}@._-]", "");
        return first.isEmpty() ? query.trim() : first;
    }

    private FallbackAttempt record(FallbackStep<?> step, FallbackAttempt.Outcome outcome, long tookMs) {
        meterRegistry.counter(
            "ts_fallback_attempt_total",
            "tier", step.tier().label(),
            "outcome", outcome.label()
        ).increment();
        return new FallbackAttempt(step.tier(), step.strategy(), outcome, tookMs);
    }

    private void warnIfSlow(FallbackStep<?> step, long tookMs) {
        if (tookMs > nearTimeoutMs) {
            logger.warn("tier={} strategy={} near timeout: {}ms (threshold {}ms)",
                step.tier().label(), step.strategy(), tookMs, nearTimeoutMs);
        }
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
