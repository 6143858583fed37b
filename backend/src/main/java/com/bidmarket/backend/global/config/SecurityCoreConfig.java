package com.bidmarket.backend.global.config;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Shared infrastructure beans: one UTC clock and one CSPRNG for salts and refresh tokens.
 */
@Configuration
@EnableScheduling
public class SecurityCoreConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }
}
