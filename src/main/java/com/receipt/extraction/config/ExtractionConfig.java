package com.receipt.extraction.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ExtractionConfig {

    @Bean
    public ExtractionRules extractionRules() {
        return ExtractionRules.defaults();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
