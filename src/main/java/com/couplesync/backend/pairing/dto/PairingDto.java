package com.couplesync.backend.pairing.dto;

import com.couplesync.backend.pairing.entity.Pairing;
import com.couplesync.backend.pairing.entity.PairingStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PairingDto(
        Long id,
        Long requesterId,
        Long partnerId,
        String partnerCode,
        PairingStatus status,
        boolean premium,
        Instant createdAt,
        Instant acceptedAt,
        Instant deletedAt
) {
    /** 邀請碼只給發起人看 */
    public static PairingDto from(Pairing p, Long viewerId) {
        String code = Objects.equals(p.getRequesterId(), viewerId) ? p.getPartnerCode() : null;
        return new PairingDto(
                p.getId(), p.getRequesterId(), p.getPartnerId(), code, p.getStatus(),
                p.isPremium(), p.getCreatedAt(), p.getAcceptedAt(), p.getDeletedAt()
        );
    }
}
