package com.couplesync.backend.guard.service;

import com.couplesync.backend.common.error.RateLimitedException;
import com.couplesync.backend.guard.config.GuardProperties;
import com.couplesync.backend.guard.store.GuardStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * ✅ 固定視窗限流（每個來源 IP）
 * - 不論哪個 scope 觸發，都回同一個 RATE_LIMITED
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RequestRateLimiter {

    public enum Scope { AUTH, FAILED_LOGIN, API }

    private final GuardStateStore store;
    private final GuardProperties props;

    /** 計數 +1 並檢查（一般 API 每個 request 都算） */
    public void hitOrThrow(Scope scope, String caller, Instant now) {
        if (!props.getRate().isEnabled() || caller == null) return;

        long start = windowStart(now);
        int n = store.incrementInWindow(key(scope, caller), start);
        if (n > limit(scope)) throw limited(scope, caller, start, now);
    }

    /** 只檢查不計數（auth 類：失敗才記） */
    public void checkOrThrow(Scope scope, String caller, Instant now) {
        if (!props.getRate().isEnabled() || caller == null) return;

        long start = windowStart(now);
        int n = store.countInWindow(key(scope, caller), start);
        if (n >= limit(scope)) throw limited(scope, caller, start, now);
    }

    public void record(Scope scope, String caller, Instant now) {
        if (!props.getRate().isEnabled() || caller == null) return;
        store.incrementInWindow(key(scope, caller), windowStart(now));
    }

    int limit(Scope scope) {
        GuardProperties.Rate r = props.getRate();
        return switch (scope) {
            case AUTH -> Math.max(1, r.getAuthLimit());
            case FAILED_LOGIN -> Math.max(1, r.getFailedLoginLimit());
            case API -> Math.max(1, r.getApiLimit());
        };
    }

    private long windowStart(Instant now) {
        long size = Math.max(1, props.getRate().getWindow().toSeconds());
        return (now.getEpochSecond() / size) * size;
    }

    private RateLimitedException limited(Scope scope, String caller, long start, Instant now) {
        long size = Math.max(1, props.getRate().getWindow().toSeconds());
        int retryAfter = (int) Math.max(0, (start + size) - now.getEpochSecond());
        log.warn("rate_limited scope={} caller={} retryAfterSec={}", scope, caller, retryAfter);
        return new RateLimitedException("RATE_LIMITED", retryAfter, "RETRY_LATER");
    }

    private static String key(Scope scope, String caller) {
        return "rate:" + scope.name() + ":" + caller;
    }
}
