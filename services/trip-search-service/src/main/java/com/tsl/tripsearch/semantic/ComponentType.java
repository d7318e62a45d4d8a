package com.tsl.tripsearch.semantic;

import java.util.Locale;

public enum ComponentType {
    CLIENT,
    DESTINATION,
    DATE,
    ACTIVITY,
    COST,
    DESCRIPTOR,
    STATUS;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ComponentType fromCode(String code) {
        return code == null ? null : valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
