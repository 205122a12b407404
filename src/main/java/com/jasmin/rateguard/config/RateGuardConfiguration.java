package com.jasmin.rateguard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RateGuardConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
