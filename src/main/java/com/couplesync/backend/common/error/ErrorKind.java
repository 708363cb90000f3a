package com.couplesync.backend.common.error;

/**
 * 對外穩定的錯誤分類；HTTP 狀態由 ApiExceptionHandler 決定
 */
public enum ErrorKind {
    NOT_FOUND,
    FORBIDDEN,
    UNAUTHORIZED,
    CONFLICT,
    INVALID_INPUT,
    EXPIRED,
    GENERATION_ERROR,
    STORE_ERROR
}
