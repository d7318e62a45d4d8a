package com.tsl.tripsearch.query.predicate;

/**
 * Node of a typed WHERE-clause tree. Leaves compare one column against bound values, branches combine children.
 */
public interface SearchPredicate {

    SqlFragment render();

    /**
     * Number of leaf comparisons, used to reason about pattern complexity.
     */
    int leafCount();
}
