package com.couplesync.backend.pairing.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Objects;

@Getter
@Setter
@Entity
@Table(
        name = "pairings",
        uniqueConstraints = @UniqueConstraint(name = "ux_pairings_code", columnNames = "partner_code"),
        indexes = {
                @Index(name = "ix_pairings_requester", columnList = "requester_id,status"),
                @Index(name = "ix_pairings_partner", columnList = "partner_id,status")
        }
)
public class Pairing {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "requester_id", nullable = false)
    private Long requesterId;

    /** accept 前為 null */
    @Column(name = "partner_id")
    private Long partnerId;

    /** 一次性邀請碼；accept / reject 後清空 */
    @Column(name = "partner_code", length = 6)
    private String partnerCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PairingStatus status = PairingStatus.PENDING;

    @Column(name = "premium", nullable = false)
    private boolean premium = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "accepted_at")
    private Instant acceptedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public boolean isParticipant(Long userId) {
        return userId != null && (Objects.equals(requesterId, userId) || Objects.equals(partnerId, userId));
    }

    /** 另一方；非參與者回 null */
    public Long otherParty(Long userId) {
        if (Objects.equals(requesterId, userId)) return partnerId;
        if (Objects.equals(partnerId, userId)) return requesterId;
        return null;
    }

    public boolean isActiveAccepted() {
        return status == PairingStatus.ACCEPTED && deletedAt == null && partnerId != null;
    }
}
