package com.example.careplan.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CarePlanConfig {

    /**
     * Clock for care plan timestamps, replaceable in tests.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
