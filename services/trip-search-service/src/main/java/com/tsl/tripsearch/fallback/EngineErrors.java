package com.tsl.tripsearch.fallback;

import java.sql.SQLTimeoutException;
import java.util.List;
import java.util.Locale;
import org.springframework.dao.QueryTimeoutException;

/**
 * Distinguishes pattern-complexity and timeout rejections from every other store failure.
 */
public final class EngineErrors {
    private static final List<String> COMPLEXITY_MARKERS = List.of(
        "too complex",
        "timeout",
        "timed out",
        "maximum statement execution time exceeded",
        "query execution was interrupted"
    );

    private EngineErrors() {
    }

    public static boolean isComplexityError(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 10) {
            if (current instanceof QueryTimeoutException || current instanceof SQLTimeoutException) {
                return true;
            }
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String marker : COMPLEXITY_MARKERS) {
                    if (lower.contains(marker)) {
                        return true;
                    }
                }
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }
}
