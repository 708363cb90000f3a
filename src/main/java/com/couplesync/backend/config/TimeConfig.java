package com.couplesync.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TimeConfig {

    /** ✅ 用 Clock 方便測試（fixed clock） */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
