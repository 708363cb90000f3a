package com.couplesync.backend.auth.dto;

import com.couplesync.backend.auth.service.TokenService;
import com.couplesync.backend.users.user.dto.UserProfileDto;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthResponse(
        String accessToken,
        String refreshToken,
        String tokenType,
        long accessTtlSec,
        long refreshTtlSec,
        long serverTimeEpochSec,
        UserProfileDto user
) {
    public static AuthResponse of(TokenService.AuthTokens t, UserProfileDto user, long nowEpochSec) {
        return new AuthResponse(
                t.accessToken(), t.refreshToken(), "Bearer",
                t.accessTtlSec(), t.refreshTtlSec(), nowEpochSec, user
        );
    }
}
