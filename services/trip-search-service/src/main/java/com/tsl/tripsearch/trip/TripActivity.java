package com.tsl.tripsearch.trip;

public record TripActivity(Integer dayNumber, String activityType, String title, double cost) {
}
