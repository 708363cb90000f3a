package com.couplesync.backend.guard.store;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ✅ MVP：process 內 map（只適用單機）
 * - 每個 key 一個 Entry，用 entry 自己當 lock
 */
public class InMemoryGuardStateStore implements GuardStateStore {

    private static final class Entry {
        final Deque<Instant> failures = new ArrayDeque<>();
        Instant lockedUntil;
        long windowStartEpochSec = Long.MIN_VALUE;
        int windowCount;
        volatile Instant lastTouched;

        Entry(Instant now) { this.lastTouched = now; }
    }

    private final ConcurrentHashMap<String, Entry> map = new ConcurrentHashMap<>();

    @Override
    public int recordFailure(String key, Instant now, Duration window) {
        Entry e = map.computeIfAbsent(key, k -> new Entry(now));
        synchronized (e) {
            prune(e, now, window);
            e.failures.addLast(now);
            e.lastTouched = now;
            return e.failures.size();
        }
    }

    @Override
    public int failureCount(String key, Instant now, Duration window) {
        Entry e = map.get(key);
        if (e == null) return 0;
        synchronized (e) {
            prune(e, now, window);
            return e.failures.size();
        }
    }

    @Override
    public void lock(String key, Instant until) {
        Entry e = map.computeIfAbsent(key, k -> new Entry(until));
        synchronized (e) {
            e.lockedUntil = until;
        }
    }

    @Override
    public Optional<Instant> lockedUntil(String key) {
        Entry e = map.get(key);
        if (e == null) return Optional.empty();
        synchronized (e) {
            return Optional.ofNullable(e.lockedUntil);
        }
    }

    @Override
    public void clear(String key) {
        map.remove(key);
    }

    @Override
    public int incrementInWindow(String key, long windowStartEpochSec) {
        Entry e = map.computeIfAbsent(key, k -> new Entry(Instant.ofEpochSecond(windowStartEpochSec)));
        synchronized (e) {
            // 進入新視窗：重置
            if (e.windowStartEpochSec != windowStartEpochSec) {
                e.windowStartEpochSec = windowStartEpochSec;
                e.windowCount = 0;
            }
            e.lastTouched = Instant.ofEpochSecond(windowStartEpochSec);
            return ++e.windowCount;
        }
    }

    @Override
    public int countInWindow(String key, long windowStartEpochSec) {
        Entry e = map.get(key);
        if (e == null) return 0;
        synchronized (e) {
            return (e.windowStartEpochSec == windowStartEpochSec) ? e.windowCount : 0;
        }
    }

    @Override
    public int evictIdle(Instant before) {
        int[] removed = {0};
        map.entrySet().removeIf(en -> {
            Entry e = en.getValue();
            synchronized (e) {
                boolean locked = e.lockedUntil != null && e.lockedUntil.isAfter(before);
                boolean idle = !locked && e.lastTouched.isBefore(before);
                if (idle) removed[0]++;
                return idle;
            }
        });
        return removed[0];
    }

    int size() {
        return map.size();
    }

    private static void prune(Entry e, Instant now, Duration window) {
        Instant cutoff = now.minus(window);
        while (!e.failures.isEmpty() && !e.failures.peekFirst().isAfter(cutoff)) {
            e.failures.pollFirst();
        }
    }
}
