package com.couplesync.backend.generation.service;

import com.couplesync.backend.generation.model.GenerationMetrics;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GenerationTelemetryTest {

    @Test
    void empty_snapshot_has_no_division_by_zero() {
        GenerationMetrics m = new GenerationTelemetry().snapshot(false);

        assertThat(m.configured()).isFalse();
        assertThat(m.totalRequests()).isZero();
        assertThat(m.averageLatencyMs()).isZero();
        assertThat(m.successRate()).isZero();
    }

    @Test
    void counts_successes_failures_and_rate_limits() {
        GenerationTelemetry t = new GenerationTelemetry();
        t.ok("OPENAI", "gpt", "PLAN", "program-1", 100, 10, 20);
        t.ok("OPENAI", "gpt", "STEP_RESPONSE", "step-1", 200, null, null);
        t.fail("OPENAI", "gpt", "PLAN", "program-2", 300, "GENERATION_RATE_LIMITED");

        GenerationMetrics m = t.snapshot(true);

        assertThat(m.configured()).isTrue();
        assertThat(m.totalRequests()).isEqualTo(3);
        assertThat(m.successfulRequests()).isEqualTo(2);
        assertThat(m.failedRequests()).isEqualTo(1);
        assertThat(m.rateLimitErrors()).isEqualTo(1);
        assertThat(m.averageLatencyMs()).isEqualTo(200);
        assertThat(m.successRate()).isEqualTo(66.7);
    }

    @Test
    void other_failures_do_not_count_as_rate_limited() {
        GenerationTelemetry t = new GenerationTelemetry();
        t.fail("OPENAI", "gpt", "PLAN", "program-1", 50, "GENERATION_TIMEOUT");

        assertThat(t.snapshot(true).rateLimitErrors()).isZero();
        assertThat(t.snapshot(true).failedRequests()).isEqualTo(1);
    }
}
