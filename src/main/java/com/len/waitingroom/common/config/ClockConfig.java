package com.len.waitingroom.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // 만료 판정은 unix seconds 기준
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
