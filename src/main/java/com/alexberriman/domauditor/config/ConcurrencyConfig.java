package com.alexberriman.domauditor.config;

import com.alexberriman.domauditor.service.concurrency.Delayer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wiring for the concurrency core.
 */
@Configuration
public class ConcurrencyConfig {

    /**
     * Timer-backed retry delay used by controllers created through the factory.
     */
    @Bean
    public Delayer retryDelayer() {
        return Delayer.system();
    }
}
