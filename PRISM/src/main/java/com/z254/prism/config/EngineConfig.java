package com.z254.prism.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Engine-wide infrastructure beans.
 */
@Configuration
public class EngineConfig {

    /**
     * Clock used for receipt timestamps, windows and pattern horizons.
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock engineClock() {
        return Clock.systemUTC();
    }
}
