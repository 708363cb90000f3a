package com.couplesync.backend.guard.config;

import com.couplesync.backend.guard.store.GuardStateStore;
import com.couplesync.backend.guard.store.InMemoryGuardStateStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(GuardProperties.class)
public class GuardConfig {

    /**
     * 單機版：process 內 map。多台部署時提供另一個 GuardStateStore bean（例如 Redis）即可替換
     */
    @Bean
    @ConditionalOnMissingBean(GuardStateStore.class)
    public GuardStateStore guardStateStore() {
        return new InMemoryGuardStateStore();
    }
}
