package com.tsl.tripsearch.query;

import com.tsl.tripsearch.query.predicate.Predicates;
import com.tsl.tripsearch.query.predicate.SearchPredicate;
import com.tsl.tripsearch.query.predicate.SqlFragment;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Builds candidate predicates for a classified query, most selective first.
 *
 * <ul>
 *   <li>comprehensive: every term must appear in some column (only for up to two terms)</li>
 *   <li>weighted: strong terms over all columns, medium terms over the first two, weak terms over the primary one</li>
 *   <li>simplified: any term in the primary column</li>
 * </ul>
 * Exact email, slug and id branches are OR-ed into every strategy.
 */
@Component
public class QueryStrategyBuilder {
    static final double HIGH_WEIGHT = 2.0;
    static final double MEDIUM_WEIGHT = 1.5;
    private static final int COMPREHENSIVE_MAX_TERMS = 2;
    private static final int MEDIUM_COLUMNS = 2;
    private static final Pattern SLUG = Pattern.compile("^[a-z0-9]+(?:-[a-z0-9]+)*$");

    public List<QueryStrategy> build(ClassifiedQuery query, SearchTarget target) {
        if (query == null || query.isEmpty()) {
            return List.of();
        }
        List<SearchPredicate> exact = exactBranches(query, target);
        List<QueryStrategy> strategies = new ArrayList<>();
        if (query.terms().size() <= COMPREHENSIVE_MAX_TERMS) {
            add(strategies, new QueryStrategy(QueryStrategy.COMPREHENSIVE, comprehensive(query.terms(), target, exact)));
        }
        add(strategies, new QueryStrategy(QueryStrategy.WEIGHTED, weighted(query.terms(), target, exact)));
        add(strategies, new QueryStrategy(QueryStrategy.SIMPLIFIED, simplified(query.terms(), target, exact)));
        return List.copyOf(strategies);
    }

    /**
     * Single-term predicate over the target's leading columns, used by the narrower fallback tiers.
     */
    public SearchPredicate primaryTermPredicate(String primaryTerm, SearchTarget target, int columns) {
        if (primaryTerm == null || primaryTerm.isBlank()) {
            return Predicates.anyOf(List.of());
        }
        return Predicates.likeAny(target.leadingColumns(columns), primaryTerm.trim());
    }

    SearchPredicate comprehensive(List<ClassifiedTerm> terms, SearchTarget target, List<SearchPredicate> exact) {
        List<SearchPredicate> perTerm = new ArrayList<>();
        for (ClassifiedTerm term : terms) {
            perTerm.add(Predicates.likeAny(target.textColumns(), term.term()));
        }
        List<SearchPredicate> branches = new ArrayList<>();
        if (!perTerm.isEmpty()) {
            branches.add(Predicates.allOf(perTerm));
        }
        branches.addAll(exact);
        return Predicates.anyOf(branches);
    }

    SearchPredicate weighted(List<ClassifiedTerm> terms, SearchTarget target, List<SearchPredicate> exact) {
        List<SearchPredicate> high = new ArrayList<>();
        List<SearchPredicate> medium = new ArrayList<>();
        List<SearchPredicate> low = new ArrayList<>();
        for (ClassifiedTerm term : terms) {
            if (term.weight() >= HIGH_WEIGHT) {
                high.add(Predicates.likeAny(target.textColumns(), term.term()));
            } else if (term.weight() >= MEDIUM_WEIGHT) {
                medium.add(Predicates.likeAny(target.leadingColumns(MEDIUM_COLUMNS), term.term()));
            } else {
                low.add(Predicates.like(target.primaryColumn(), term.term()));
            }
        }
        List<SearchPredicate> branches = new ArrayList<>();
        if (!high.isEmpty()) {
            branches.add(Predicates.allOf(high));
        }
        if (!medium.isEmpty()) {
            branches.add(Predicates.anyOf(medium));
        }
        if (!low.isEmpty()) {
            branches.add(Predicates.anyOf(low));
        }
        branches.addAll(exact);
        return Predicates.anyOf(branches);
    }

    SearchPredicate simplified(List<ClassifiedTerm> terms, SearchTarget target, List<SearchPredicate> exact) {
        List<SearchPredicate> branches = new ArrayList<>();
        for (ClassifiedTerm term : terms) {
            branches.add(Predicates.like(target.primaryColumn(), term.term()));
        }
        branches.addAll(exact);
        return Predicates.anyOf(branches);
    }

    List<SearchPredicate> exactBranches(ClassifiedQuery query, SearchTarget target) {
        List<SearchPredicate> exact = new ArrayList<>();
        if (target.emailColumn() != null) {
            for (String email : query.emails()) {
                exact.add(Predicates.equalsIgnoreCase(target.emailColumn(), email));
            }
        }
        if (target.slugColumn() != null && query.slugCandidate() != null && SLUG.matcher(query.slugCandidate()).matches()) {
            exact.add(Predicates.equalsIgnoreCase(target.slugColumn(), query.slugCandidate()));
        }
        if (target.idColumn() != null && !query.numericIds().isEmpty()) {
            exact.add(Predicates.in(target.idColumn(), query.numericIds()));
        }
        return exact;
    }

    // strategies rendering to the same SQL would only repeat a failed or empty query
    private static void add(List<QueryStrategy> strategies, QueryStrategy strategy) {
        SqlFragment rendered = strategy.predicate().render();
        boolean duplicate = strategies.stream()
            .anyMatch(existing -> existing.predicate().render().equals(rendered));
        if (!duplicate) {
            strategies.add(strategy);
        }
    }
}
