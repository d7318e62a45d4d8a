package com.tsl.tripsearch.query.predicate;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

public record EqualsPredicate(String column, Object value, boolean ignoreCase) implements SearchPredicate {

    public EqualsPredicate {
        ColumnNames.require(column);
        Objects.requireNonNull(value, "value");
    }

    @Override
    public SqlFragment render() {
        if (ignoreCase && value instanceof String text) {
            return new SqlFragment("LOWER(" + column + ") = ?", List.of(text.toLowerCase(Locale.ROOT)));
        }
        return new SqlFragment(column + " = ?", List.of(value));
    }

    @Override
    public int leafCount() {
        return 1;
    }
}
