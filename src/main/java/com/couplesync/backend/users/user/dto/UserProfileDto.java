package com.couplesync.backend.users.user.dto;

import com.couplesync.backend.users.user.entity.User;

import java.time.Instant;

public record UserProfileDto(
        Long id,
        String email,
        String userName,
        String partnerName,
        Integer children,
        int maxPairings,
        Instant createdAt
) {
    public static UserProfileDto from(User u) {
        return new UserProfileDto(
                u.getId(), u.getEmail(), u.getUserName(), u.getPartnerName(),
                u.getChildren(), u.getMaxPairings(), u.getCreatedAt()
        );
    }
}
