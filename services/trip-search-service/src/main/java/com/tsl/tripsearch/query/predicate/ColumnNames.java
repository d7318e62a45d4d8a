package com.tsl.tripsearch.query.predicate;

import java.util.regex.Pattern;

final class ColumnNames {
    private static final Pattern IDENTIFIER = Pattern.compile("^[a-z_][a-z0-9_]*(\\.[a-z_][a-z0-9_]*)?$");

    private ColumnNames() {
    }

    static String require(String column) {
        if (column == null || !IDENTIFIER.matcher(column).matches()) {
            throw new IllegalArgumentException("Invalid column identifier: " + column);
        }
        return column;
    }
}
