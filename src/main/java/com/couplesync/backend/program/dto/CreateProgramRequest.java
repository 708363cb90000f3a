package com.couplesync.backend.program.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * @param pairingId 可選；有帶就必須是自己參與且已 accepted 的 pairing
 * @param stepsRequiredForUnlock 可選；沒帶用 app.program.steps-required-for-unlock，上限是計畫天數
 */
public record CreateProgramRequest(
        @NotBlank @Size(max = 2000) String userInput,
        Long pairingId,
        @Min(1) Integer stepsRequiredForUnlock
) {}
