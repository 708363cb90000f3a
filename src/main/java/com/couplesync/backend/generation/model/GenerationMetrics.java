package com.couplesync.backend.generation.model;

/**
 * process 啟動以來的生成呼叫統計（重啟歸零）
 *
 * @param configured 是否接上真的 provider；stub 模式下其他欄位都是 0
 * @param successRate 0~100，還沒有任何呼叫時是 0
 */
public record GenerationMetrics(
        boolean configured,
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        long rateLimitErrors,
        long averageLatencyMs,
        double successRate
) {}
