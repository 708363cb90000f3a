package com.couplesync.backend.guard.service;

import com.couplesync.backend.guard.config.GuardProperties;
import com.couplesync.backend.guard.store.GuardStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Slf4j
@Component
@RequiredArgsConstructor
public class GuardStateJanitor {

    private final GuardStateStore store;
    private final GuardProperties props;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.guard.janitor-delay-ms:300000}")
    public void evictIdle() {
        int n = store.evictIdle(clock.instant().minus(props.getIdleEviction()));
        if (n > 0) log.debug("guard_state_evicted count={}", n);
    }
}
