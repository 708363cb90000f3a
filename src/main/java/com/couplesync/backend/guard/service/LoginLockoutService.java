package com.couplesync.backend.guard.service;

import com.couplesync.backend.guard.config.GuardProperties;
import com.couplesync.backend.guard.store.GuardStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * 帳號層級的滑動視窗鎖定（key = 小寫 email）
 * - 只擋「登入嘗試」，已發出的 session 不受影響
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginLockoutService {

    private static final String PREFIX = "lockout:";

    private final GuardStateStore store;
    private final GuardProperties props;

    /**
     * @return 這次失敗是否讓帳號進入鎖定
     */
    public boolean recordFailure(String identifier, Instant now) {
        String key = key(identifier);
        GuardProperties.Lockout cfg = props.getLockout();

        int recent = store.recordFailure(key, now, cfg.getAttemptWindow());
        if (recent >= cfg.getThreshold()) {
            Instant until = now.plus(cfg.getLockDuration());
            store.lock(key, until);
            log.warn("security_account_locked identifier={} failures={} lockedUntil={}", mask(identifier), recent, until);
            return true;
        }
        return false;
    }

    /**
     * 讀取時順便解鎖：鎖已過期就把鎖與失敗紀錄一起清掉
     */
    public boolean isLocked(String identifier, Instant now) {
        String key = key(identifier);
        Optional<Instant> until = store.lockedUntil(key);
        if (until.isEmpty()) return false;

        if (!now.isBefore(until.get())) {
            store.clear(key);
            log.info("security_lock_expired identifier={}", mask(identifier));
            return false;
        }
        return true;
    }

    /** 登入成功就清掉歷史 */
    public void clearFailures(String identifier) {
        store.clear(key(identifier));
    }

    public LockInfo lockInfo(String identifier, Instant now) {
        String key = key(identifier);
        int failures = store.failureCount(key, now, props.getLockout().getAttemptWindow());
        Optional<Instant> until = store.lockedUntil(key);
        if (until.isEmpty() || !now.isBefore(until.get())) {
            return new LockInfo(false, null, 0, failures);
        }
        long remaining = Duration.between(now, until.get()).toSeconds();
        return new LockInfo(true, until.get(), Math.max(1, remaining), failures);
    }

    private static String key(String identifier) {
        String id = (identifier == null) ? "" : identifier.trim().toLowerCase(Locale.ROOT);
        return PREFIX + id;
    }

    static String mask(String email) {
        if (email == null) return "null";
        int at = email.indexOf('@');
        if (at <= 1) return "***";
        return email.charAt(0) + "***" + email.substring(at);
    }

    public record LockInfo(boolean locked, Instant unlockAt, long remainingSec, int failedAttempts) {}
}
