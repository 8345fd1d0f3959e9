package com.supplyradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Clock used to derive the default history range ("today" in UTC).
 */
@Configuration
public class HistoryConfig {

    @Bean
    public Clock utcClock() {
        return Clock.systemUTC();
    }
}
