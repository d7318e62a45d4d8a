package com.tsl.tripsearch.semantic;

import java.util.List;
import java.util.Locale;

/**
 * Scores the components a trip matched against the components extracted from the query.
 */
public final class SemanticScorer {
    static final double MATCH_BONUS_PER_COMPONENT = 0.1;
    static final double MAX_MATCH_BONUS = 0.5;

    private SemanticScorer() {
    }

    /**
     * Matched weight over possible query weight, plus 0.1 per matched component capped at 0.5.
     * Each query component counts with the highest-weighted trip component of the same type that matches it.
     */
    public static double score(List<QueryComponent> queryComponents, List<SemanticComponent> matched) {
        if (queryComponents.isEmpty()) {
            return 0.0;
        }
        double possible = 0.0;
        double achieved = 0.0;
        for (QueryComponent queryComponent : queryComponents) {
            possible += queryComponent.weight();
            double best = 0.0;
            for (SemanticComponent component : matched) {
                if (matches(queryComponent, component) && component.weight() > best) {
                    best = component.weight();
                }
            }
            achieved += queryComponent.weight() * best;
        }
        double bonus = Math.min(matched.size() * MATCH_BONUS_PER_COMPONENT, MAX_MATCH_BONUS);
        return achieved / possible + bonus;
    }

    static boolean matches(QueryComponent queryComponent, SemanticComponent component) {
        if (queryComponent.type() != component.type()) {
            return false;
        }
        String wanted = queryComponent.value().toLowerCase(Locale.ROOT);
        String value = component.value().toLowerCase(Locale.ROOT);
        if (value.contains(wanted) || wanted.contains(value)) {
            return true;
        }
        for (String synonym : component.synonyms()) {
            if (synonym.toLowerCase(Locale.ROOT).contains(wanted)) {
                return true;
            }
        }
        return false;
    }
}
