package com.tsl.tripsearch.semantic;

import java.util.List;

public record SemanticMatch(
    long tripId,
    String tripName,
    String tripSlug,
    double semanticScore,
    List<SemanticComponent> matchedComponents,
    String searchMethod
) {
    public static final String METHOD = "semantic_component_matching";
}
