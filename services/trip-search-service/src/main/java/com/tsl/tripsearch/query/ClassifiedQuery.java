package com.tsl.tripsearch.query;

import java.util.List;

/**
 * Classified form of a free-text query.
 *
 * @param raw            original input, untouched
 * @param terms          weighted terms used to build search predicates, at most the configured cap
 * @param mode           exact for identifier or email lookups, broad for long queries, fuzzy otherwise
 * @param tokens         lower-cased alphanumeric tokens used for scoring
 * @param emails         lower-cased email addresses found in the input
 * @param numericIds     positive integers found in the input
 * @param slugCandidate  the input lower-cased with whitespace runs replaced by hyphens
 */
public record ClassifiedQuery(
    String raw,
    List<ClassifiedTerm> terms,
    SearchMode mode,
    List<String> tokens,
    List<String> emails,
    List<Long> numericIds,
    String slugCandidate
) {
    public static ClassifiedQuery empty(String raw) {
        return new ClassifiedQuery(raw, List.of(), SearchMode.FUZZY, List.of(), List.of(), List.of(), null);
    }

    public boolean isEmpty() {
        return terms.isEmpty() && emails.isEmpty() && numericIds.isEmpty();
    }

    public List<String> termValues() {
        return terms.stream().map(ClassifiedTerm::term).toList();
    }
}
