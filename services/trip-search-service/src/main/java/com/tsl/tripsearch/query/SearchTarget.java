package com.tsl.tripsearch.query;

import java.util.List;

/**
 * Columns a strategy may search. The first text column is the primary one; exact columns are optional.
 */
public record SearchTarget(
    String name,
    List<String> textColumns,
    String emailColumn,
    String slugColumn,
    String idColumn
) {
    public SearchTarget {
        if (textColumns == null || textColumns.isEmpty()) {
            throw new IllegalArgumentException("At least one text column is required for " + name);
        }
        textColumns = List.copyOf(textColumns);
    }

    public String primaryColumn() {
        return textColumns.get(0);
    }

    public List<String> leadingColumns(int count) {
        return textColumns.subList(0, Math.min(count, textColumns.size()));
    }
}
