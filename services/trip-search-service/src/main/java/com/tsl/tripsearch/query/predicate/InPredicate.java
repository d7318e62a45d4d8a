package com.tsl.tripsearch.query.predicate;

import java.util.Collections;
import java.util.List;

public record InPredicate(String column, List<?> values) implements SearchPredicate {

    public InPredicate {
        ColumnNames.require(column);
        values = List.copyOf(values);
    }

    @Override
    public SqlFragment render() {
        if (values.isEmpty()) {
            return MatchNonePredicate.INSTANCE.render();
        }
        String placeholders = String.join(", ", Collections.nCopies(values.size(), "?"));
        return new SqlFragment(column + " IN (" + placeholders + ")", List.copyOf(values));
    }

    @Override
    public int leafCount() {
        return 1;
    }
}
