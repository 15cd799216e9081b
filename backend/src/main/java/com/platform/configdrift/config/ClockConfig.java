package com.platform.configdrift.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /**
     * Clock used for snapshot file timestamps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
