package com.tsl.tripsearch.trip;

import java.time.Instant;

public record TransitLeg(Instant departAt, Instant arriveAt) {
}
