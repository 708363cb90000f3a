package com.couplesync.backend.auth.token;

import com.couplesync.backend.auth.utils.SecureToken;
import com.couplesync.backend.common.crypto.HmacSha256;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;

/**
 * 簽章 token：base64url(JSON claims) + "." + base64url(HMAC-SHA256)
 * 驗證順序：格式 → 簽章 → 型別 → 過期
 */
public class AccessTokenCodec {

    private static final Base64.Encoder ENC = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DEC = Base64.getUrlDecoder();

    private final String secret;
    private final String issuer;
    private final ObjectMapper om;
    private final Clock clock;

    public AccessTokenCodec(String secret, String issuer, ObjectMapper om, Clock clock) {
        this.secret = secret;
        this.issuer = issuer;
        this.om = om;
        this.clock = clock;
    }

    public String sign(Long userId, String email, String type, Duration ttl) {
        long now = clock.instant().getEpochSecond();
        TokenClaims claims = new TokenClaims(
                userId, email, type, issuer, now, now + ttl.toSeconds(), SecureToken.newTokenHex(8)
        );
        try {
            String payload = ENC.encodeToString(om.writeValueAsBytes(claims));
            return payload + "." + HmacSha256.base64Url(secret, payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("TOKEN_SIGN_FAILED", e);
        }
    }

    public TokenClaims verify(String token, String expectedType) {
        return verify(token, expectedType, true);
    }

    /**
     * @param enforceExpiry refresh token 的期限以 DB row 為準（會滑動），這裡傳 false 只驗簽與格式
     */
    public TokenClaims verify(String token, String expectedType, boolean enforceExpiry) {
        if (token == null || token.isBlank()) throw new TokenVerificationException(TokenVerificationException.Failure.MALFORMED);

        int dot = token.indexOf('.');
        if (dot <= 0 || dot != token.lastIndexOf('.') || dot == token.length() - 1) {
            throw new TokenVerificationException(TokenVerificationException.Failure.MALFORMED);
        }

        String payload = token.substring(0, dot);
        String sig = token.substring(dot + 1);
        if (!HmacSha256.verifyBase64Url(secret, payload, sig)) {
            throw new TokenVerificationException(TokenVerificationException.Failure.INVALID_SIGNATURE);
        }

        TokenClaims claims;
        try {
            claims = om.readValue(new String(DEC.decode(payload), StandardCharsets.UTF_8), TokenClaims.class);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new TokenVerificationException(TokenVerificationException.Failure.MALFORMED);
        }

        if (claims.sub() == null || !expectedType.equals(claims.typ()) || !issuer.equals(claims.iss())) {
            throw new TokenVerificationException(TokenVerificationException.Failure.MALFORMED);
        }
        if (enforceExpiry && claims.exp() <= clock.instant().getEpochSecond()) {
            throw new TokenVerificationException(TokenVerificationException.Failure.EXPIRED);
        }
        return claims;
    }
}
