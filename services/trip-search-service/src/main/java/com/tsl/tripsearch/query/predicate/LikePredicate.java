package com.tsl.tripsearch.query.predicate;

import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive substring match. Wildcards inside the value are escaped with {@code !}.
 */
public record LikePredicate(String column, String value) implements SearchPredicate {
    static final char ESCAPE = '!';

    public LikePredicate {
        ColumnNames.require(column);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("LIKE value must not be empty");
        }
    }

    @Override
    public SqlFragment render() {
        String pattern = "%" + escape(value.toLowerCase(Locale.ROOT)) + "%";
        return new SqlFragment("LOWER(" + column + ") LIKE ? ESCAPE '" + ESCAPE + "'", List.of(pattern));
    }

    @Override
    public int leafCount() {
        return 1;
    }

    public static String escape(String raw) {
        StringBuilder escaped = new StringBuilder(raw.length() + 4);
        for (char c : raw.toCharArray()) {
            if (c == '%' || c == '_' || c == ESCAPE) {
                escaped.append(ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
