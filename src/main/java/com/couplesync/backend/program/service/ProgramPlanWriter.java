package com.couplesync.backend.program.service;

import com.couplesync.backend.generation.model.ProgramPlan;
import com.couplesync.backend.program.entity.PlanStatus;
import com.couplesync.backend.program.entity.Program;
import com.couplesync.backend.program.entity.ProgramStep;
import com.couplesync.backend.program.repo.ProgramRepository;
import com.couplesync.backend.program.repo.ProgramStepRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;

/**
 * 生成結果落地（背景 thread 呼叫，自己開 transaction）
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProgramPlanWriter {

    private final ProgramRepository programs;
    private final ProgramStepRepository steps;
    private final Clock clock;

    /**
     * @return 寫入的 step 數；program 已刪除或已不是 GENERATING 就回 0
     */
    @Transactional
    public int writeSteps(Long programId, ProgramPlan plan) {
        Program program = programs.findActiveById(programId).orElse(null);
        if (program == null || program.getPlanStatus() != PlanStatus.GENERATING) {
            log.info("program_plan_discarded programId={}", programId);
            return 0;
        }
        if (steps.countByProgramId(programId) > 0) {
            log.warn("program_plan_steps_exist programId={}", programId);
            return 0;
        }

        List<ProgramPlan.PlanDay> days = plan.days().stream()
                .sorted(Comparator.comparingInt(ProgramPlan.PlanDay::day))
                .toList();
        for (ProgramPlan.PlanDay d : days) {
            ProgramStep s = new ProgramStep();
            s.setProgramId(programId);
            s.setDay(d.day());
            s.setTheme(d.theme().trim());
            s.setConversationStarter(d.conversationStarter().trim());
            s.setScienceBehindIt(d.scienceBehindIt() == null ? null : d.scienceBehindIt().trim());
            s.setCreatedAt(clock.instant());
            steps.save(s);
        }

        program.setTitle(clip(plan.title(), 255));
        program.setOverview(clip(plan.overview(), 2000));
        program.setPlanStatus(PlanStatus.READY);
        program.setGenerationError(null);
        return days.size();
    }

    @Transactional
    public void markFailed(Long programId, String code) {
        int n = programs.finishGeneration(programId, PlanStatus.FAILED, code);
        if (n == 0) log.info("program_plan_fail_skipped programId={} code={}", programId, code);
    }

    private static String clip(String s, int max) {
        if (s == null) return null;
        String t = s.trim();
        return t.length() <= max ? t : t.substring(0, max);
    }
}
