package com.couplesync.backend.auth.token;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * token payload
 * - typ: access / refresh
 * - jti: 隨機值，確保同一秒簽出來的 refresh token 也不會相同
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenClaims(
        Long sub,
        String email,
        String typ,
        String iss,
        long iat,
        long exp,
        String jti
) {
    public static final String TYPE_ACCESS = "access";
    public static final String TYPE_REFRESH = "refresh";
}
