package com.tsl.tripsearch.query.predicate;

import java.util.List;

/**
 * A rendered WHERE-clause fragment. Values only ever travel in {@link #params()}.
 */
public record SqlFragment(String sql, List<Object> params) {
    public SqlFragment {
        params = List.copyOf(params);
    }

    public Object[] paramsArray() {
        return params.toArray();
    }
}
