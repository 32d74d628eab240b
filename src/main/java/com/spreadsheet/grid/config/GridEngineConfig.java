package com.spreadsheet.grid.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class GridEngineConfig {

    /**
     * Time source for TODAY() and NOW().
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
