package com.couplesync.backend.contribution.service;

import com.couplesync.backend.contribution.repo.StepContributionRepository;
import com.couplesync.backend.program.dto.UnlockStatus;
import com.couplesync.backend.program.entity.Program;
import com.couplesync.backend.program.repo.ProgramRepository;
import com.couplesync.backend.program.repo.ProgramStepRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * step 的「誰講過話」+ started 旗標 + program 解鎖判斷
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContributionTracker {

    private final StepContributionRepository contributions;
    private final ProgramStepRepository steps;
    private final ProgramRepository programs;
    private final Clock clock;

    /**
     * 冪等 insert
     * @return true 只有在這次是 (step, user) 的第一筆
     */
    @Transactional
    public boolean recordFirstContribution(Long stepId, Long userId) {
        boolean first = contributions.insertFirst(stepId, userId, clock.instant()) == 1;
        if (first) log.info("step_contribution_first stepId={} userId={}", stepId, userId);
        return first;
    }

    @Transactional(readOnly = true)
    public boolean hasContributed(Long stepId, Long userId) {
        return contributions.existsByStepIdAndUserId(stepId, userId);
    }

    /** false → true 只翻一次；已經 started 就是 no-op（回 false） */
    @Transactional
    public boolean markStepStarted(Long stepId) {
        boolean flipped = steps.markStarted(stepId, clock.instant()) == 1;
        if (flipped) log.info("step_started stepId={}", stepId);
        return flipped;
    }

    @Transactional(readOnly = true)
    public boolean computeUnlockStatus(Long programId, int requiredStepCount) {
        return steps.countByProgramIdAndStartedTrue(programId) >= requiredStepCount;
    }

    @Transactional(readOnly = true)
    public UnlockStatus unlockStatus(Program program) {
        long started = steps.countByProgramIdAndStartedTrue(program.getId());
        int required = program.getStepsRequiredForUnlock();
        return new UnlockStatus(started, required, program.isNextProgramUnlocked() || started >= required);
    }

    /**
     * 達標就把 next_program_unlocked 寫進去（只寫一次，之後不會被關回去）
     * @return 目前是否已解鎖
     */
    @Transactional
    public boolean refreshUnlockFlag(Program program) {
        if (program.isNextProgramUnlocked()) return true;
        if (!computeUnlockStatus(program.getId(), program.getStepsRequiredForUnlock())) return false;

        if (programs.markUnlocked(program.getId()) == 1) {
            log.info("program_unlocked programId={} required={}", program.getId(), program.getStepsRequiredForUnlock());
        }
        program.setNextProgramUnlocked(true);
        return true;
    }
}
