package com.couplesync.backend.users.user.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * 部分更新：null = 不改
 */
public record UpdateProfileRequest(
        @Size(max = 255) String userName,
        @Size(max = 255) String partnerName,
        @Min(0) Integer children
) {
    public boolean isEmpty() {
        return userName == null && partnerName == null && children == null;
    }
}
