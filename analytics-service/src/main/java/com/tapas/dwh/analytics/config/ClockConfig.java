package com.tapas.dwh.analytics.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Evaluation clock for time-dependent report fields (age, days since last order).
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock evaluationClock() {
        return Clock.systemDefaultZone();
    }
}
