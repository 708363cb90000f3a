package com.couplesync.backend.message.dto;

import com.couplesync.backend.trigger.service.TriggerOutcome;

/**
 * @param trigger 這則訊息對 AI 回應觸發的影響（FIRED 代表回應正在背景生成）
 */
public record PostMessageResult(
        StepMessageDto message,
        boolean stepStarted,
        boolean programUnlocked,
        TriggerOutcome trigger
) {}
