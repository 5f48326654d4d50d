package com.phillippitts.jobpipeline.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** UTC wall clock; replaced with a fixed or mutable clock in tests. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
