package com.customdim.service.core.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    /** Stamps cache snapshots. */
    @Bean
    @ConditionalOnMissingBean
    public Clock customDimensionsClock() {
        return Clock.systemUTC();
    }
}
