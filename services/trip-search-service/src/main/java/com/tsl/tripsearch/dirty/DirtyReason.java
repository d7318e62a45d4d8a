package com.tsl.tripsearch.dirty;

import java.util.Locale;

public enum DirtyReason {
    TRIP_INSERT,
    TRIP_UPDATE,
    TRIP_DELETE,
    TRAVELER_INSERT,
    TRAVELER_UPDATE,
    TRAVELER_DELETE,
    ACTIVITY_INSERT,
    ACTIVITY_UPDATE,
    ACTIVITY_DELETE,
    LEG_INSERT,
    LEG_UPDATE,
    LEG_DELETE,
    MANUAL;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
