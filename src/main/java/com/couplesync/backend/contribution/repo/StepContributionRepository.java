package com.couplesync.backend.contribution.repo;

import com.couplesync.backend.contribution.entity.StepContribution;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

public interface StepContributionRepository extends JpaRepository<StepContribution, Long> {

    /**
     * 第一次：回 1；重複（含 retry）：回 0
     * 只吞 ux_step_contrib 的 duplicate，其他錯誤（NOT NULL、型別）照樣丟出來
     * 連線要開 useAffectedRows=true，否則 duplicate 也回 1
     */
    @Modifying(flushAutomatically = true)
    @Query(
            value = """
            INSERT INTO step_contributions(step_id, user_id, contributed_at)
            VALUES (:stepId, :userId, :now)
            ON DUPLICATE KEY UPDATE id = id
            """,
            nativeQuery = true
    )
    int insertFirst(@Param("stepId") Long stepId, @Param("userId") Long userId, @Param("now") Instant now);

    boolean existsByStepIdAndUserId(Long stepId, Long userId);

    long countByStepId(Long stepId);
}
