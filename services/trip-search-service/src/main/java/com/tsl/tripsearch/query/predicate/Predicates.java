package com.tsl.tripsearch.query.predicate;

import java.util.ArrayList;
import java.util.List;

public final class Predicates {
    private Predicates() {
    }

    public static SearchPredicate like(String column, String value) {
        return new LikePredicate(column, value);
    }

    public static SearchPredicate equalsIgnoreCase(String column, String value) {
        return new EqualsPredicate(column, value, true);
    }

    public static SearchPredicate equalTo(String column, Object value) {
        return new EqualsPredicate(column, value, false);
    }

    public static SearchPredicate in(String column, List<?> values) {
        return new InPredicate(column, values);
    }

    public static SearchPredicate allOf(List<SearchPredicate> children) {
        return combine(CompositePredicate.Operator.AND, children);
    }

    public static SearchPredicate anyOf(List<SearchPredicate> children) {
        List<SearchPredicate> kept = new ArrayList<>();
        for (SearchPredicate child : children) {
            if (child != MatchNonePredicate.INSTANCE) {
                kept.add(child);
            }
        }
        if (kept.isEmpty()) {
            return MatchNonePredicate.INSTANCE;
        }
        return combine(CompositePredicate.Operator.OR, kept);
    }

    public static SearchPredicate likeAny(List<String> columns, String value) {
        List<SearchPredicate> likes = new ArrayList<>();
        for (String column : columns) {
            likes.add(like(column, value));
        }
        return anyOf(likes);
    }

    private static SearchPredicate combine(CompositePredicate.Operator operator, List<SearchPredicate> children) {
        if (children.size() == 1) {
            return children.get(0);
        }
        List<SearchPredicate> flattened = new ArrayList<>();
        for (SearchPredicate child : children) {
            if (child instanceof CompositePredicate composite && composite.operator() == operator) {
                flattened.addAll(composite.children());
            } else {
                flattened.add(child);
            }
        }
        return new CompositePredicate(operator, flattened);
    }
}
