package com.couplesync.backend.generation.client;

/**
 * @param purpose     PROGRAM_PLAN / STEP_RESPONSE（只用於 log 與 stub）
 * @param referenceId programId / stepId，方便 log 追蹤
 */
public record GenerationRequest(
        Purpose purpose,
        String referenceId,
        String systemPrompt,
        String userPrompt
) {
    public enum Purpose { PROGRAM_PLAN, STEP_RESPONSE }
}
