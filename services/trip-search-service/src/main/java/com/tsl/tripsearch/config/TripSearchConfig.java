package com.tsl.tripsearch.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TripSearchProperties.class)
public class TripSearchConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
