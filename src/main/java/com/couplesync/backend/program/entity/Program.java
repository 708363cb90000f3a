package com.couplesync.backend.program.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(
        name = "programs",
        indexes = {
                @Index(name = "ix_programs_user", columnList = "user_id"),
                @Index(name = "ix_programs_pairing", columnList = "pairing_id")
        }
)
public class Program {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** owner */
    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "pairing_id")
    private Long pairingId;

    @Column(name = "user_input", nullable = false, length = 2000)
    private String userInput;

    /** 上一期（形成鏈） */
    @Column(name = "previous_program_id")
    private Long previousProgramId;

    @Column(name = "title")
    private String title;

    @Column(name = "overview", length = 2000)
    private String overview;

    @Enumerated(EnumType.STRING)
    @Column(name = "plan_status", nullable = false, length = 16)
    private PlanStatus planStatus = PlanStatus.GENERATING;

    @Column(name = "generation_error", length = 64)
    private String generationError;

    @Column(name = "steps_required_for_unlock", nullable = false)
    private int stepsRequiredForUnlock = 7;

    @Column(name = "next_program_unlocked", nullable = false)
    private boolean nextProgramUnlocked = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
