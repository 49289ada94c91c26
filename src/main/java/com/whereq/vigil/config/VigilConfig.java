package com.whereq.vigil.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core beans shared by the scan engine and the schedule evaluator.
 *
 * @author WhereQ Inc.
 */
@Configuration
public class VigilConfig {

    /**
     * Source of "now" for job timestamps and schedule arithmetic
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
