package com.tsl.tripsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TripSearchServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(TripSearchServiceApplication.class, args);
    }
}
