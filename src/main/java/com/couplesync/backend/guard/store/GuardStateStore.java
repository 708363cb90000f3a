package com.couplesync.backend.guard.store;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * keyed expiring-counter store：lockout 與 rate limit 共用
 */
public interface GuardStateStore {

    /**
     * 追加一筆失敗時間，移除 window 以外的舊紀錄
     * @return 修剪後 window 內的失敗數（含這一筆）
     */
    int recordFailure(String key, Instant now, Duration window);

    int failureCount(String key, Instant now, Duration window);

    void lock(String key, Instant until);

    Optional<Instant> lockedUntil(String key);

    /** 清掉該 key 的失敗紀錄與鎖 */
    void clear(String key);

    /**
     * 固定視窗計數：windowStart 變了就歸零
     * @return 這次 +1 之後的數字
     */
    int incrementInWindow(String key, long windowStartEpochSec);

    int countInWindow(String key, long windowStartEpochSec);

    /** 清掉 before 之後沒再被碰過的 key，回傳清掉幾個 */
    int evictIdle(Instant before);
}
