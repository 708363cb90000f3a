package com.couplesync.backend.contribution.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * 某人在某 step 的「第一次發言」紀錄，(step_id, user_id) 唯一
 */
@Getter
@Setter
@Entity
@Table(
        name = "step_contributions",
        uniqueConstraints = @UniqueConstraint(name = "ux_step_contrib", columnNames = {"step_id", "user_id"})
)
public class StepContribution {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "step_id", nullable = false)
    private Long stepId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "contributed_at", nullable = false)
    private Instant contributedAt;
}
