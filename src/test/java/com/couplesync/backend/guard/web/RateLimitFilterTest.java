package com.couplesync.backend.guard.web;

import com.couplesync.backend.guard.config.GuardProperties;
import com.couplesync.backend.guard.service.RequestRateLimiter;
import com.couplesync.backend.guard.store.InMemoryGuardStateStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitFilterTest {

    private RateLimitFilter filter;

    @BeforeEach
    void setUp() {
        GuardProperties props = new GuardProperties();
        props.getRate().setApiLimit(3);
        props.getRate().setAuthLimit(2);
        filter = new RateLimitFilter(
                new RequestRateLimiter(new InMemoryGuardStateStore(), props),
                new ObjectMapper(),
                Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    private static MockHttpServletRequest request(String uri, String remoteAddr, String xff) {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", uri);
        req.setRemoteAddr(remoteAddr);
        if (xff != null) req.addHeader("X-Forwarded-For", xff);
        return req;
    }

    private int call(MockHttpServletRequest req) throws Exception {
        MockHttpServletResponse res = new MockHttpServletResponse();
        filter.doFilter(req, res, new MockFilterChain());
        return res.getStatus();
    }

    @Test
    void rotating_forwarded_for_does_not_reset_the_bucket() throws Exception {
        int rejected = 0;
        for (int i = 0; i < 50; i++) {
            if (call(request("/api/programs", "9.9.9.9", "10.0.0." + i)) == 429) rejected++;
        }

        assertThat(rejected).isEqualTo(47);
    }

    @Test
    void rejection_carries_retry_after_and_uniform_code() throws Exception {
        for (int i = 0; i < 3; i++) call(request("/api/programs", "9.9.9.9", null));

        MockHttpServletResponse res = new MockHttpServletResponse();
        filter.doFilter(request("/api/programs", "9.9.9.9", null), res, new MockFilterChain());

        assertThat(res.getStatus()).isEqualTo(429);
        assertThat(res.getHeader("Retry-After")).isNotBlank();
        assertThat(res.getContentAsString()).contains("\"code\":\"RATE_LIMITED\"");
    }

    @Test
    void separate_remote_addresses_have_separate_buckets() throws Exception {
        for (int i = 0; i < 3; i++) call(request("/api/programs", "9.9.9.9", null));

        assertThat(call(request("/api/programs", "9.9.9.9", null))).isEqualTo(429);
        assertThat(call(request("/api/programs", "8.8.8.8", "9.9.9.9"))).isEqualTo(200);
    }

    @Test
    void failed_auth_responses_count_against_the_caller_even_with_spoofed_header() throws Exception {
        for (int i = 0; i < 2; i++) {
            MockHttpServletResponse res = new MockHttpServletResponse();
            FilterChain failing = (rq, rs) -> ((HttpServletResponse) rs).setStatus(401);
            filter.doFilter(request("/auth/login", "9.9.9.9", "1.1.1." + i), res, failing);
        }

        assertThat(call(request("/auth/login", "9.9.9.9", "7.7.7.7"))).isEqualTo(429);
    }
}
