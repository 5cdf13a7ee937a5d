package org.jstats.matchsync_api.core.config;

import org.jstats.matchsync_api.modules.sources.fetch.Pacer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TimeConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    Pacer pacer() {
        return Pacer.sleeping();
    }
}
