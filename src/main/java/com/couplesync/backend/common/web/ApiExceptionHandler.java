package com.couplesync.backend.common.web;

import com.couplesync.backend.common.error.AccountLockedException;
import com.couplesync.backend.common.error.DomainException;
import com.couplesync.backend.common.error.RateLimitedException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

/**
 * 統一錯誤格式：{code, message, requestId, clientAction?, retryAfterSec?}
 * - DomainException：依 ErrorKind 對應 HTTP 狀態
 * - 429：限流 / 登入鎖定（帶 Retry-After）
 * - 500：其他未預期錯誤
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ApiErrorResponse> handleDomain(DomainException ex, HttpServletRequest req) {
        HttpStatus status = switch (ex.kind()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case UNAUTHORIZED, EXPIRED -> HttpStatus.UNAUTHORIZED;
            case CONFLICT -> HttpStatus.CONFLICT;
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case GENERATION_ERROR -> HttpStatus.BAD_GATEWAY;
            case STORE_ERROR -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        if (status.is5xxServerError()) {
            log.warn("api_error code={} kind={}", ex.code(), ex.kind(), ex);
        }
        return ResponseEntity.status(status)
                .body(ApiErrorResponse.of(ex.code(), messageFor(ex.code()), rid(req)));
    }

    @ExceptionHandler(AccountLockedException.class)
    public ResponseEntity<ApiErrorResponse> handleLocked(AccountLockedException ex, HttpServletRequest req) {
        int sec = Math.max(0, ex.retryAfterSec());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(sec))
                .body(new ApiErrorResponse(
                        "ACCOUNT_LOCKED",
                        "Account temporarily locked due to too many failed login attempts. Try again in "
                        + Math.max(1, (sec + 59) / 60) + " minute(s).",
                        rid(req),
                        "RETRY_LATER",
                        sec
                ));
    }

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ApiErrorResponse> handleRateLimited(RateLimitedException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.retryAfterSec()))
                .body(new ApiErrorResponse(
                        "RATE_LIMITED",
                        "Too many requests, please try again later.",
                        rid(req),
                        ex.clientAction(),
                        ex.retryAfterSec()
                ));
    }

    /**
     * Bean Validation（@Valid）失敗：例如 @NotBlank / @Size
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        String msg = ex.getBindingResult().getFieldErrors().isEmpty()
                ? "VALIDATION_FAILED"
                : ex.getBindingResult().getFieldErrors().get(0).getField()
                  + " " + ex.getBindingResult().getFieldErrors().get(0).getDefaultMessage();

        return ResponseEntity.badRequest().body(ApiErrorResponse.of("VALIDATION_FAILED", msg, rid(req)));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex, HttpServletRequest req) {
        return ResponseEntity.badRequest().body(ApiErrorResponse.of("BAD_REQUEST", "Malformed request", rid(req)));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiErrorResponse> handleStatus(ResponseStatusException ex, HttpServletRequest req) {
        String code = (ex.getReason() == null) ? "ERROR" : ex.getReason();
        return ResponseEntity.status(ex.getStatusCode()).body(ApiErrorResponse.of(code, null, rid(req)));
    }

    // ===== 500 Fallback =====

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnknown(Exception ex, HttpServletRequest req) {
        log.error("api_unhandled type={}", ex.getClass().getSimpleName(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiErrorResponse.of("INTERNAL_ERROR", "Internal server error", rid(req)));
    }

    private static String rid(HttpServletRequest req) {
        return RequestIdFilter.getOrCreate(req);
    }

    private static String messageFor(String code) {
        return switch (code) {
            case "INVALID_CREDENTIALS" -> "Invalid email or password";
            case "TOKEN_EXPIRED" -> "Token expired";
            case "TOKEN_INVALID" -> "Invalid token";
            case "QUOTA_EXCEEDED" -> "Maximum pairings reached";
            case "DUPLICATE_PENDING_REQUEST" -> "A pending pairing request already exists";
            case "SELF_PAIRING" -> "Cannot pair with yourself";
            case "ALREADY_PAIRED" -> "Already paired with this user";
            case "ALREADY_PROCESSED" -> "Pairing request already processed";
            default -> code;
        };
    }
}
