package com.couplesync.backend.auth.service;

import com.couplesync.backend.common.error.AccountLockedException;
import com.couplesync.backend.common.error.DomainException;
import com.couplesync.backend.common.error.ErrorKind;
import com.couplesync.backend.guard.service.LoginLockoutService;
import com.couplesync.backend.guard.service.RequestRateLimiter;
import com.couplesync.backend.users.user.entity.User;
import com.couplesync.backend.users.user.repo.UserRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;

/**
 * email + password 登入
 * 順序：IP 失敗限流 → 帳號鎖定 → 驗密碼 → (失敗) 記錄 / (成功) 清除並發 token
 */
@Slf4j
@Service
public class PasswordAuthService {

    private final UserRepo userRepo;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;
    private final LoginLockoutService lockout;
    private final RequestRateLimiter rateLimiter;
    private final Clock clock;

    /** 帳號不存在時也跑一次 matches，避免用回應時間判斷 email 是否註冊 */
    private final String dummyHash;

    public PasswordAuthService(UserRepo userRepo,
                               PasswordEncoder passwordEncoder,
                               TokenService tokenService,
                               LoginLockoutService lockout,
                               RequestRateLimiter rateLimiter,
                               Clock clock) {
        this.userRepo = userRepo;
        this.passwordEncoder = passwordEncoder;
        this.tokenService = tokenService;
        this.lockout = lockout;
        this.rateLimiter = rateLimiter;
        this.clock = clock;
        this.dummyHash = passwordEncoder.encode("timing-equalizer");
    }

    public LoginResult login(String email, String password, String clientIp) {
        Instant now = clock.instant();
        String normalized = (email == null) ? "" : email.trim().toLowerCase(Locale.ROOT);

        rateLimiter.checkOrThrow(RequestRateLimiter.Scope.FAILED_LOGIN, clientIp, now);

        if (lockout.isLocked(normalized, now)) {
            throw locked(normalized, now);
        }

        User user = userRepo.findActiveByEmail(normalized).orElse(null);
        boolean ok = passwordEncoder.matches(
                password == null ? "" : password,
                user == null ? dummyHash : user.getPasswordHash()
        );

        if (!ok || user == null) {
            rateLimiter.record(RequestRateLimiter.Scope.FAILED_LOGIN, clientIp, now);
            boolean lockedNow = lockout.recordFailure(normalized, now);
            log.warn("login_failed ip={} lockedNow={}", clientIp, lockedNow);
            if (lockedNow) throw locked(normalized, now);
            throw new DomainException(ErrorKind.UNAUTHORIZED, "INVALID_CREDENTIALS");
        }

        lockout.clearFailures(normalized);
        TokenService.AuthTokens tokens = tokenService.issueTokens(user);
        log.info("login_ok userId={}", user.getId());
        return new LoginResult(user, tokens);
    }

    private AccountLockedException locked(String email, Instant now) {
        LoginLockoutService.LockInfo info = lockout.lockInfo(email, now);
        return new AccountLockedException(info.unlockAt(), (int) info.remainingSec());
    }

    public record LoginResult(User user, TokenService.AuthTokens tokens) {}
}
