package com.faultline.triage.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans.
 */
@Configuration
public class TriageConfiguration {

    /**
     * Single source of "now" for durations, open-incident windows and learned timestamps.
     */
    @Bean
    public Clock triageClock() {
        return Clock.systemUTC();
    }
}
