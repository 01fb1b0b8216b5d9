package com.paywise.budget.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(PaywiseProperties properties) {
        return Clock.system(properties.analysis().zoneId());
    }
}
