package com.kreasipositif.ipcacorrection.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Pins "now" for every Spring-backed test.
 */
@TestConfiguration
public class FixedClockConfig {

    public static final Instant NOW = Instant.parse("2025-01-20T12:00:00Z");

    @Bean
    @Primary
    public Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }
}
