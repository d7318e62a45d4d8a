package com.tsl.tripsearch.query;

public record ClassifiedTerm(String term, double weight, TermCategory category) {
}
