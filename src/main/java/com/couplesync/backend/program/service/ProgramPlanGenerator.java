package com.couplesync.backend.program.service;

import com.couplesync.backend.common.error.DomainException;
import com.couplesync.backend.generation.model.ProgramPlan;
import com.couplesync.backend.generation.service.ContentGenerationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

/**
 * 計畫生成：離開 request thread，在 generationExecutor 上跑
 * 失敗只記在 program.generation_error，不重試
 */
@Slf4j
@Component
public class ProgramPlanGenerator {

    private final ContentGenerationService content;
    private final ProgramPlanWriter writer;
    private final TaskExecutor executor;

    public ProgramPlanGenerator(ContentGenerationService content,
                                ProgramPlanWriter writer,
                                @Qualifier("generationExecutor") TaskExecutor executor) {
        this.content = content;
        this.writer = writer;
        this.executor = executor;
    }

    public void schedule(PlanJob job) {
        try {
            executor.execute(() -> run(job));
        } catch (RuntimeException e) {
            // queue 滿（TaskRejectedException）
            log.warn("program_plan_rejected programId={} err={}", job.programId(), e.getClass().getSimpleName());
            writer.markFailed(job.programId(), "GENERATION_REJECTED");
        }
    }

    void run(PlanJob job) {
        long t0 = System.nanoTime();
        try {
            ProgramPlan plan = content.generatePlan(
                    job.userName(), job.partnerName(), job.seed(), job.previousStarters(), "program-" + job.programId());
            int written = writer.writeSteps(job.programId(), plan);
            log.info("program_plan_ready programId={} steps={} latencyMs={}",
                    job.programId(), written, (System.nanoTime() - t0) / 1_000_000);
        } catch (DomainException e) {
            log.warn("program_plan_failed programId={} code={}", job.programId(), e.code());
            writer.markFailed(job.programId(), e.code());
        } catch (RuntimeException e) {
            log.warn("program_plan_failed programId={} code=GENERATION_FAILED err={}",
                    job.programId(), e.getClass().getSimpleName(), e);
            writer.markFailed(job.programId(), "GENERATION_FAILED");
        }
    }
}
