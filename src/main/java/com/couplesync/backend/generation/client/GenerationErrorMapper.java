package com.couplesync.backend.generation.client;

import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * RestClient 例外 → 穩定錯誤碼
 */
public final class GenerationErrorMapper {

    private GenerationErrorMapper() {}

    public static String map(Throwable e) {
        if (e == null) return "GENERATION_FAILED";

        // 先攔 timeout（RestClient 常把 SocketTimeoutException 包在 ResourceAccessException 裡）
        if (isTimeout(e)) return "GENERATION_TIMEOUT";

        if (e instanceof GenerationException ge) return ge.code();

        if (e instanceof RestClientResponseException re) {
            int status = re.getStatusCode().value();
            if (status == 401 || status == 403) return "GENERATION_AUTH_FAILED";
            if (status == 429) return "GENERATION_RATE_LIMITED";
            if (status == 408) return "GENERATION_TIMEOUT";
            if (re.getStatusCode().is5xxServerError()) return "GENERATION_UPSTREAM_5XX";
            return "GENERATION_BAD_REQUEST";
        }

        if (e instanceof ResourceAccessException) return "GENERATION_NETWORK_ERROR";
        if (e instanceof RestClientException) return "GENERATION_CLIENT_ERROR";

        return "GENERATION_FAILED";
    }

    static boolean isTimeout(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof SocketTimeoutException) return true;
            if (c instanceof TimeoutException) return true;
            if ("java.net.http.HttpTimeoutException".equals(c.getClass().getName())) return true;

            String m = c.getMessage();
            if (m != null) {
                String s = m.toLowerCase(Locale.ROOT);
                if (s.contains("timed out") || s.contains("timeout")) return true;
            }
            if (c.getCause() == c) break;
        }
        return false;
    }
}
