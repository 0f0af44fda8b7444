package com.ella.insights.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Reference clock for every "today"-relative window (trailing months, overdue age).
 * Tests replace it with {@link Clock#fixed}.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock insightsClock() {
        return Clock.systemDefaultZone();
    }
}
