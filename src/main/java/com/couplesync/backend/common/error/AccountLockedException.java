package com.couplesync.backend.common.error;

import java.time.Instant;

/**
 * 登入鎖定中（與一般帳密錯誤分開回應，帶剩餘秒數）
 */
public class AccountLockedException extends RuntimeException {

    private final Instant lockedUntil;
    private final int retryAfterSec;

    public AccountLockedException(Instant lockedUntil, int retryAfterSec) {
        super("ACCOUNT_LOCKED");
        this.lockedUntil = lockedUntil;
        this.retryAfterSec = retryAfterSec;
    }

    public Instant lockedUntil() { return lockedUntil; }
    public int retryAfterSec() { return retryAfterSec; }
}
