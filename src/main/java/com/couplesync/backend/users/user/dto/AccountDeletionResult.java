package com.couplesync.backend.users.user.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 帳號刪除結果：主要 tombstone 一定成功，cascade 為 best-effort
 * - *Count = null 代表該 cascade 失敗，*Error 帶錯誤碼
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccountDeletionResult(
        Long userId,
        Integer pairingsDeleted,
        String pairingsError,
        Integer sessionsRevoked,
        String sessionsError
) {
    public boolean fullyCascaded() {
        return pairingsError == null && sessionsError == null;
    }
}
