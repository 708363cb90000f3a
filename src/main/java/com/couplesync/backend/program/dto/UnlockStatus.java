package com.couplesync.backend.program.dto;

public record UnlockStatus(
        long startedSteps,
        int stepsRequired,
        boolean unlocked
) {}
