package com.tsl.tripsearch.trip;

public record Traveler(String email, String fullName, String role) {
}
