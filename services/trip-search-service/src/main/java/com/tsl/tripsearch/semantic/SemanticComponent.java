package com.tsl.tripsearch.semantic;

import java.util.List;

/**
 * A typed, weighted fact about a trip, such as a destination or a client name, with the alternative spellings it
 * should also match.
 */
public record SemanticComponent(
    long tripId,
    ComponentType type,
    String value,
    double weight,
    List<String> synonyms,
    String source
) {
    public SemanticComponent {
        synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
    }
}
