package com.couplesync.backend.auth.config;

import com.couplesync.backend.auth.token.AccessTokenCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(AuthProperties.class)
public class AuthConfig {

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(12);
    }

    @Bean
    public AccessTokenCodec accessTokenCodec(AuthProperties props, ObjectMapper om, Clock clock) {
        // ✅ Fail-fast：啟動就抓到 secret 缺失 / 太短
        String secret = props.getTokenSecret();
        if (secret == null || secret.isBlank()) throw new IllegalStateException("AUTH_TOKEN_SECRET_MISSING");
        if (secret.length() < 32) throw new IllegalStateException("AUTH_TOKEN_SECRET_TOO_SHORT");
        return new AccessTokenCodec(secret, props.getIssuer(), om, clock);
    }
}
