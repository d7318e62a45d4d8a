package com.tsl.tripsearch.query;

import com.tsl.tripsearch.query.predicate.SearchPredicate;

public record QueryStrategy(String name, SearchPredicate predicate) {
    public static final String COMPREHENSIVE = "comprehensive";
    public static final String WEIGHTED = "weighted";
    public static final String SIMPLIFIED = "simplified";
}
