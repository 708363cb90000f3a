package com.couplesync.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
public class BackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(BackendApplication.class, args);
    }

    /**
     * ✅ 測試環境不要啟動排程
     * guard state 的清理 job 在 test 內由測試自己呼叫
     */
    @Configuration
    @Profile("!test")
    @EnableScheduling
    static class SchedulingEnabledConfig {
        // no-op
    }
}
