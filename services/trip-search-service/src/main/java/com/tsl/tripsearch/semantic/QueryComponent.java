package com.tsl.tripsearch.semantic;

public record QueryComponent(ComponentType type, String value, double weight) {
}
