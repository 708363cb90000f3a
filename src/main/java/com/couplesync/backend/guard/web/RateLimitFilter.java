package com.couplesync.backend.guard.web;

import com.couplesync.backend.common.error.RateLimitedException;
import com.couplesync.backend.common.web.ApiErrorResponse;
import com.couplesync.backend.common.web.ClientIp;
import com.couplesync.backend.common.web.RequestIdFilter;
import com.couplesync.backend.guard.service.RequestRateLimiter;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;

/**
 * IP 層級限流：
 * - /auth/**：先檢查，回應 4xx/5xx 才計數（成功的登入不算）
 * - /api/**：每個 request 都計數
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
public class RateLimitFilter extends OncePerRequestFilter {

    private final RequestRateLimiter limiter;
    private final ObjectMapper om;
    private final Clock clock;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String p = request.getRequestURI();
        return !(p.startsWith("/auth") || p.startsWith("/api"));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String ip = ClientIp.of(req);
        boolean auth = req.getRequestURI().startsWith("/auth");

        try {
            if (auth) {
                limiter.checkOrThrow(RequestRateLimiter.Scope.AUTH, ip, clock.instant());
            } else {
                limiter.hitOrThrow(RequestRateLimiter.Scope.API, ip, clock.instant());
            }
        } catch (RateLimitedException e) {
            reject(req, res, e);
            return;
        }

        chain.doFilter(req, res);

        if (auth && res.getStatus() >= 400) {
            limiter.record(RequestRateLimiter.Scope.AUTH, ip, clock.instant());
        }
    }

    private void reject(HttpServletRequest req, HttpServletResponse res, RateLimitedException e) throws IOException {
        res.setStatus(429);
        res.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(e.retryAfterSec()));
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        om.writeValue(res.getWriter(), new ApiErrorResponse(
                "RATE_LIMITED",
                "Too many requests, please try again later.",
                RequestIdFilter.getOrCreate(req),
                e.clientAction(),
                e.retryAfterSec()
        ));
    }
}
