package com.tsl.tripsearch.query.predicate;

import java.util.List;

public enum MatchNonePredicate implements SearchPredicate {
    INSTANCE;

    @Override
    public SqlFragment render() {
        return new SqlFragment("1 = 0", List.of());
    }

    @Override
    public int leafCount() {
        return 0;
    }
}
