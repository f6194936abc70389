package com.alibou.randomchat.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Random;

/**
 * Общие источники времени и случайности, в тестах подменяются.
 */
@Configuration
public class AppConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    /** Для выбора пар. */
    @Bean
    public Random pairingRandom() {
        return new SecureRandom();
    }
}
