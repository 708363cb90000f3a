package com.couplesync.backend.auth.service;

import com.couplesync.backend.auth.config.AuthProperties;
import com.couplesync.backend.auth.entity.RefreshToken;
import com.couplesync.backend.auth.repo.RefreshTokenRepo;
import com.couplesync.backend.auth.token.AccessTokenCodec;
import com.couplesync.backend.auth.token.TokenClaims;
import com.couplesync.backend.auth.token.TokenVerificationException;
import com.couplesync.backend.auth.utils.SecureToken;
import com.couplesync.backend.common.error.DomainException;
import com.couplesync.backend.common.error.ErrorKind;
import com.couplesync.backend.users.user.entity.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * session 生命週期：Issued → (Refreshed)* → Revoked
 * - access token 只驗簽不查 DB
 * - refresh token 單次使用，DB 只存 hash
 */
@Slf4j
@Service
public class TokenService {

    private final RefreshTokenRepo repo;
    private final AccessTokenCodec codec;
    private final AuthProperties props;
    private final Clock clock;
    private final TaskExecutor touchExecutor;

    public TokenService(
            RefreshTokenRepo repo,
            AccessTokenCodec codec,
            AuthProperties props,
            Clock clock,
            @Qualifier("sessionTouchExecutor") TaskExecutor touchExecutor
    ) {
        this.repo = repo;
        this.codec = codec;
        this.props = props;
        this.clock = clock;
        this.touchExecutor = touchExecutor;
    }

    /** 登入：舊的 refresh rows 全部作廢，只留這一顆 */
    @Transactional
    public AuthTokens issueTokens(User user) {
        Instant now = clock.instant();
        int superseded = repo.deleteAllByUserId(user.getId());

        String access = codec.sign(user.getId(), user.getEmail(), TokenClaims.TYPE_ACCESS, props.getAccessTtl());
        String refresh = codec.sign(user.getId(), user.getEmail(), TokenClaims.TYPE_REFRESH, props.getRefreshTtl());

        RefreshToken row = new RefreshToken();
        row.setUserId(user.getId());
        row.setTokenHash(SecureToken.sha256Hex(refresh));
        row.setCreatedAt(now);
        row.setExpiresAt(now.plus(props.getRefreshTtl()));
        repo.save(row);

        log.info("session_issued userId={} superseded={}", user.getId(), superseded);
        return pair(access, refresh);
    }

    /**
     * refresh 旋轉：舊 token 立即失效（single-use），新 token 重新計算期限
     * 簽章錯 / 過期 / row 不存在 一律 INVALID_OR_EXPIRED_TOKEN
     */
    @Transactional
    public AuthTokens refresh(String refreshToken) {
        TokenClaims claims;
        try {
            // 期限看 DB row（extendOnActivity 會往後推），簽章錯就直接擋
            claims = codec.verify(refreshToken, TokenClaims.TYPE_REFRESH, false);
        } catch (TokenVerificationException e) {
            log.info("session_refresh_rejected reason={}", e.failure());
            throw invalidOrExpired();
        }

        Instant now = clock.instant();
        String access = codec.sign(claims.sub(), claims.email(), TokenClaims.TYPE_ACCESS, props.getAccessTtl());
        String next = codec.sign(claims.sub(), claims.email(), TokenClaims.TYPE_REFRESH, props.getRefreshTtl());

        int n = repo.rotate(
                SecureToken.sha256Hex(refreshToken),
                SecureToken.sha256Hex(next),
                now.plus(props.getRefreshTtl()),
                now
        );
        if (n == 0) {
            log.info("session_refresh_rejected reason=ROW_MISSING userId={}", claims.sub());
            throw invalidOrExpired();
        }

        log.info("session_refreshed userId={}", claims.sub());
        return pair(access, next);
    }

    /** 登出：刪掉對應 row；不存在也當成功 */
    public void logout(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) return;
        int n = repo.deleteByTokenHash(SecureToken.sha256Hex(refreshToken));
        log.info("session_logout removed={}", n);
    }

    /**
     * access token 驗證（filter 用）
     * @throws TokenVerificationException EXPIRED / INVALID_SIGNATURE / MALFORMED
     */
    public TokenClaims verifyAccess(String accessToken) {
        return codec.verify(accessToken, TokenClaims.TYPE_ACCESS);
    }

    /**
     * 滑動 session：丟到背景 executor，錯誤只記 log，不影響 request
     */
    public void extendOnActivity(Long userId) {
        if (userId == null) return;
        try {
            touchExecutor.execute(() -> touch(userId));
        } catch (RuntimeException e) {
            // executor 滿了 / 關閉中
            log.warn("session_extend_skipped userId={} reason={}", userId, e.getClass().getSimpleName());
        }
    }

    void touch(Long userId) {
        try {
            Instant now = clock.instant();
            repo.extendForUser(userId, now.plus(props.getRefreshTtl()), now);
        } catch (RuntimeException e) {
            log.warn("session_extend_failed userId={} err={}", userId, e.toString());
        }
    }

    /** 帳號 tombstone 時呼叫：回傳刪掉的 session 數 */
    @Transactional
    public int cascadeRevokeForAccount(Long userId) {
        int n = repo.deleteAllByUserId(userId);
        log.info("session_cascade_revoked userId={} count={}", userId, n);
        return n;
    }

    private AuthTokens pair(String access, String refresh) {
        return new AuthTokens(access, refresh, props.getAccessTtl().toSeconds(), props.getRefreshTtl().toSeconds());
    }

    private static DomainException invalidOrExpired() {
        return new DomainException(ErrorKind.UNAUTHORIZED, "INVALID_OR_EXPIRED_TOKEN");
    }

    public record AuthTokens(String accessToken, String refreshToken, long accessTtlSec, long refreshTtlSec) {}
}
