package com.assessval.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Registers {@link ValuationProperties} and the shared {@link Clock}.
 * Lineage timestamps come from this clock; tests swap in a fixed one.
 */
@Configuration
@EnableConfigurationProperties(ValuationProperties.class)
public class ConfigurationPropertiesEnablerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
