package com.couplesync.backend.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.auth")
public class AuthProperties {

    /** HMAC 簽章金鑰：用環境變數帶入 APP_AUTH_TOKEN_SECRET */
    private String tokenSecret;

    /** access token 存活時間 */
    private Duration accessTtl = Duration.ofHours(24);

    /** refresh token 存活時間；每次有活動會往後滑動 */
    private Duration refreshTtl = Duration.ofDays(14);

    private String issuer = "couplesync";
}
