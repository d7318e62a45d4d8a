package com.tsl.tripsearch.query.predicate;

import java.util.ArrayList;
import java.util.List;

/**
 * AND / OR over child predicates. An empty conjunction matches everything, an empty disjunction nothing.
 */
public record CompositePredicate(Operator operator, List<SearchPredicate> children) implements SearchPredicate {

    public enum Operator {
        AND,
        OR
    }

    public CompositePredicate {
        children = List.copyOf(children);
    }

    @Override
    public SqlFragment render() {
        if (children.isEmpty()) {
            return new SqlFragment(operator == Operator.AND ? "1 = 1" : "1 = 0", List.of());
        }
        if (children.size() == 1) {
            return children.get(0).render();
        }
        List<String> parts = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        for (SearchPredicate child : children) {
            SqlFragment fragment = child.render();
            parts.add(child instanceof CompositePredicate ? "(" + fragment.sql() + ")" : fragment.sql());
            params.addAll(fragment.params());
        }
        return new SqlFragment(String.join(" " + operator.name() + " ", parts), params);
    }

    @Override
    public int leafCount() {
        int count = 0;
        for (SearchPredicate child : children) {
            count += child.leafCount();
        }
        return count;
    }
}
