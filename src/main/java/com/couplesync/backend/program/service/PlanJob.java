package com.couplesync.backend.program.service;

import java.util.List;

/** commit 之後交給 generationExecutor 的計畫生成工作 */
public record PlanJob(
        Long programId,
        String userName,
        String partnerName,
        String seed,
        List<String> previousStarters
) {}
