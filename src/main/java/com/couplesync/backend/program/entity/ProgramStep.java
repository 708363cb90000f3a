package com.couplesync.backend.program.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(
        name = "program_steps",
        uniqueConstraints = @UniqueConstraint(name = "ux_program_steps_day", columnNames = {"program_id", "day"})
)
public class ProgramStep {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "program_id", nullable = false)
    private Long programId;

    @Column(name = "day", nullable = false)
    private int day;

    @Column(name = "theme", nullable = false)
    private String theme;

    @Column(name = "conversation_starter", nullable = false, length = 1000)
    private String conversationStarter;

    @Column(name = "science_behind_it", length = 2000)
    private String scienceBehindIt;

    /** false → true 只會發生一次 */
    @Column(name = "started", nullable = false)
    private boolean started = false;

    @Column(name = "started_at")
    private Instant startedAt;

    /** 兩人都第一次發言後，AI 回應只觸發一次（compare-and-set 標記） */
    @Column(name = "response_triggered_at")
    private Instant responseTriggeredAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
