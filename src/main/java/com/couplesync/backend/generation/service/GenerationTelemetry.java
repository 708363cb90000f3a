package com.couplesync.backend.generation.service;

import com.couplesync.backend.generation.model.GenerationMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.LongAdder;

@Slf4j
@Service
public class GenerationTelemetry {

    static final String RATE_LIMITED = "GENERATION_RATE_LIMITED";

    private final LongAdder successes = new LongAdder();
    private final LongAdder failures = new LongAdder();
    private final LongAdder rateLimited = new LongAdder();
    private final LongAdder latencyMsTotal = new LongAdder();

    public void ok(String provider, String model, String purpose, String refId, long latencyMs,
                   Integer promptTok, Integer completionTok) {
        successes.increment();
        latencyMsTotal.add(latencyMs);
        log.info("generation_call status=OK provider={} model={} purpose={} refId={} latencyMs={} tokensPrompt={} tokensCompletion={}",
                safe(provider), safe(model), safe(purpose), safe(refId), latencyMs, n(promptTok), n(completionTok));
    }

    public void fail(String provider, String model, String purpose, String refId, long latencyMs, String errorCode) {
        failures.increment();
        latencyMsTotal.add(latencyMs);
        if (RATE_LIMITED.equals(errorCode)) rateLimited.increment();
        log.warn("generation_call status=FAIL provider={} model={} purpose={} refId={} latencyMs={} errorCode={}",
                safe(provider), safe(model), safe(purpose), safe(refId), latencyMs, safe(errorCode));
    }

    /** 各計數分開讀，併發下彼此可能差一兩筆 */
    public GenerationMetrics snapshot(boolean configured) {
        long ok = successes.sum();
        long failed = failures.sum();
        long total = ok + failed;
        long avg = (total == 0) ? 0 : latencyMsTotal.sum() / total;
        double rate = (total == 0) ? 0.0 : Math.round(ok * 1000.0 / total) / 10.0;
        return new GenerationMetrics(configured, total, ok, failed, rateLimited.sum(), avg, rate);
    }

    private static String safe(String s) {
        return (s == null || s.isBlank()) ? "-" : s;
    }

    private static String n(Integer v) {
        return v == null ? "-" : String.valueOf(v);
    }
}
