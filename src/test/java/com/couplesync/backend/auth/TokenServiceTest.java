package com.couplesync.backend.auth;

import com.couplesync.backend.auth.config.AuthProperties;
import com.couplesync.backend.auth.entity.RefreshToken;
import com.couplesync.backend.auth.repo.RefreshTokenRepo;
import com.couplesync.backend.auth.service.TokenService;
import com.couplesync.backend.auth.token.AccessTokenCodec;
import com.couplesync.backend.auth.token.TokenClaims;
import com.couplesync.backend.auth.token.TokenVerificationException;
import com.couplesync.backend.auth.utils.SecureToken;
import com.couplesync.backend.common.error.DomainException;
import com.couplesync.backend.common.error.ErrorKind;
import com.couplesync.backend.users.user.entity.User;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TokenServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    /** tokenHash → row（模擬 refresh_tokens 表） */
    private final Map<String, RefreshToken> rows = new HashMap<>();

    private RefreshTokenRepo repo;
    private AuthProperties props;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        repo = mock(RefreshTokenRepo.class);
        props = new AuthProperties();
        clock = new MutableClock(T0);

        when(repo.save(any(RefreshToken.class))).thenAnswer(inv -> {
            RefreshToken r = inv.getArgument(0);
            rows.put(r.getTokenHash(), r);
            return r;
        });
        when(repo.deleteAllByUserId(anyLong())).thenAnswer(inv -> {
            Long uid = inv.getArgument(0);
            int before = rows.size();
            rows.values().removeIf(r -> r.getUserId().equals(uid));
            return before - rows.size();
        });
        when(repo.deleteByTokenHash(anyString())).thenAnswer(inv -> rows.remove((String) inv.getArgument(0)) == null ? 0 : 1);
        when(repo.rotate(anyString(), anyString(), any(Instant.class), any(Instant.class))).thenAnswer(inv -> {
            String oldHash = inv.getArgument(0);
            Instant now = inv.getArgument(3);
            RefreshToken r = rows.get(oldHash);
            if (r == null || !r.getExpiresAt().isAfter(now)) return 0;
            rows.remove(oldHash);
            r.setTokenHash(inv.getArgument(1));
            r.setExpiresAt(inv.getArgument(2));
            rows.put(r.getTokenHash(), r);
            return 1;
        });
        when(repo.extendForUser(anyLong(), any(Instant.class), any(Instant.class))).thenAnswer(inv -> {
            Long uid = inv.getArgument(0);
            Instant until = inv.getArgument(1);
            Instant now = inv.getArgument(2);
            int n = 0;
            for (RefreshToken r : rows.values()) {
                if (r.getUserId().equals(uid) && r.getExpiresAt().isAfter(now)) {
                    r.setExpiresAt(until);
                    n++;
                }
            }
            return n;
        });
    }

    private TokenService service(TaskExecutor executor) {
        AccessTokenCodec codec = new AccessTokenCodec("0123456789abcdef0123456789abcdef", props.getIssuer(),
                new ObjectMapper(), clock);
        return new TokenService(repo, codec, props, clock, executor);
    }

    private static User user(long id, String email) {
        User u = new User();
        u.setId(id);
        u.setEmail(email);
        return u;
    }

    private static void assertInvalidOrExpired(Throwable t) {
        assertThat(t).isInstanceOf(DomainException.class).hasMessage("INVALID_OR_EXPIRED_TOKEN");
        assertThat(((DomainException) t).kind()).isEqualTo(ErrorKind.UNAUTHORIZED);
    }

    @Test
    void issueTokens_should_supersede_previous_sessions_of_same_user() {
        TokenService svc = service(new SyncTaskExecutor());

        TokenService.AuthTokens first = svc.issueTokens(user(1L, "amy@example.com"));
        TokenService.AuthTokens second = svc.issueTokens(user(1L, "amy@example.com"));

        assertThat(rows).hasSize(1).containsKey(SecureToken.sha256Hex(second.refreshToken()));
        assertThat(first.accessTtlSec()).isEqualTo(24 * 3600);
        assertThat(first.refreshTtlSec()).isEqualTo(14 * 24 * 3600);

        // 舊的 refresh token 已被取代
        assertInvalidOrExpired(catchThrowable(() -> svc.refresh(first.refreshToken())));
    }

    @Test
    void refresh_should_rotate_and_old_token_becomes_unusable() {
        TokenService svc = service(new SyncTaskExecutor());
        TokenService.AuthTokens a = svc.issueTokens(user(1L, "amy@example.com"));

        clock.advance(Duration.ofMinutes(1));
        TokenService.AuthTokens b = svc.refresh(a.refreshToken());

        assertThat(b.refreshToken()).isNotEqualTo(a.refreshToken());
        assertThat(svc.verifyAccess(b.accessToken()).sub()).isEqualTo(1L);

        // single-use：A 再用一次就失敗，B 還能用
        assertInvalidOrExpired(catchThrowable(() -> svc.refresh(a.refreshToken())));
        assertThatCode(() -> svc.refresh(b.refreshToken())).doesNotThrowAnyException();
    }

    @Test
    void refresh_after_row_expiry_should_fail() {
        TokenService svc = service(new SyncTaskExecutor());
        TokenService.AuthTokens a = svc.issueTokens(user(1L, "amy@example.com"));

        clock.advance(Duration.ofDays(15));

        assertInvalidOrExpired(catchThrowable(() -> svc.refresh(a.refreshToken())));
    }

    @Test
    void refresh_with_forged_or_access_token_should_fail_without_touching_store() {
        TokenService svc = service(new SyncTaskExecutor());
        TokenService.AuthTokens a = svc.issueTokens(user(1L, "amy@example.com"));

        assertInvalidOrExpired(catchThrowable(() -> svc.refresh(a.accessToken())));
        assertInvalidOrExpired(catchThrowable(() -> svc.refresh(a.refreshToken() + "x")));
        verify(repo, never()).rotate(anyString(), anyString(), any(), any());
    }

    @Test
    void logout_should_be_idempotent() {
        TokenService svc = service(new SyncTaskExecutor());
        TokenService.AuthTokens a = svc.issueTokens(user(1L, "amy@example.com"));

        svc.logout(a.refreshToken());
        assertThatCode(() -> svc.logout(a.refreshToken())).doesNotThrowAnyException();
        assertThatCode(() -> svc.logout(null)).doesNotThrowAnyException();

        assertThat(rows).isEmpty();
        assertInvalidOrExpired(catchThrowable(() -> svc.refresh(a.refreshToken())));
    }

    @Test
    void extendOnActivity_should_slide_expiry_forward() {
        TokenService svc = service(new SyncTaskExecutor());
        TokenService.AuthTokens a = svc.issueTokens(user(1L, "amy@example.com"));

        // 13 天後有活動 → 期限變成「現在 + 14 天」
        clock.advance(Duration.ofDays(13));
        svc.extendOnActivity(1L);

        RefreshToken row = rows.get(SecureToken.sha256Hex(a.refreshToken()));
        assertThat(row.getExpiresAt()).isEqualTo(T0.plus(Duration.ofDays(27)));

        // 原本第 14 天就會過期，現在第 20 天仍可 refresh
        clock.advance(Duration.ofDays(7));
        assertThatCode(() -> svc.refresh(a.refreshToken())).doesNotThrowAnyException();
    }

    @Test
    void extendOnActivity_errors_are_swallowed() {
        TaskExecutor rejecting = task -> { throw new TaskRejectedException("full"); };
        assertThatCode(() -> service(rejecting).extendOnActivity(1L)).doesNotThrowAnyException();

        doThrow(new IllegalStateException("db down")).when(repo).extendForUser(anyLong(), any(), any());
        assertThatCode(() -> service(new SyncTaskExecutor()).extendOnActivity(1L)).doesNotThrowAnyException();
    }

    @Test
    void cascadeRevokeForAccount_removes_all_rows_of_user() {
        TokenService svc = service(new SyncTaskExecutor());
        TokenService.AuthTokens a = svc.issueTokens(user(1L, "amy@example.com"));
        svc.issueTokens(user(2L, "bob@example.com"));

        assertThat(svc.cascadeRevokeForAccount(1L)).isEqualTo(1);
        assertThat(rows).hasSize(1);
        assertInvalidOrExpired(catchThrowable(() -> svc.refresh(a.refreshToken())));
    }

    @Test
    void verifyAccess_distinguishes_expired() {
        TokenService svc = service(new SyncTaskExecutor());
        TokenService.AuthTokens a = svc.issueTokens(user(1L, "amy@example.com"));

        clock.advance(Duration.ofHours(25));

        TokenVerificationException ex = catchThrowableOfType(() -> svc.verifyAccess(a.accessToken()),
                TokenVerificationException.class);
        assertThat(ex.isExpired()).isTrue();
        assertThat(svc.verifyAccess(svc.refresh(a.refreshToken()).accessToken()).typ())
                .isEqualTo(TokenClaims.TYPE_ACCESS);
    }

    /** 測試用可前進的 clock */
    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) { this.now = now; }

        void advance(Duration d) { now = now.plus(d); }

        @Override public ZoneOffset getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(java.time.ZoneId zone) { return this; }
        @Override public Instant instant() { return now; }
    }
}
