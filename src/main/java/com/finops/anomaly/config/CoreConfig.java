package com.finops.anomaly.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CoreConfig {

    // Default time for samples and alerts that carry no timestamp
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
