package com.company.pmm.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(MonitoringProperties.class)
public class MonitoringConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
