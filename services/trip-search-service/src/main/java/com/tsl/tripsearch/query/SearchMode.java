package com.tsl.tripsearch.query;

public enum SearchMode {
    EXACT,
    FUZZY,
    BROAD
}
