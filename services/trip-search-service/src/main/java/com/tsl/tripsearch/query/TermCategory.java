package com.tsl.tripsearch.query;

public enum TermCategory {
    EMAIL(3.0),
    NAME(2.0),
    LOCATION(1.5),
    NUMBER(1.8),
    DESCRIPTOR(1.3),
    GENERIC(1.0);

    private final double weight;

    TermCategory(double weight) {
        this.weight = weight;
    }

    public double weight() {
        return weight;
    }
}
