package com.couplesync.backend.generation.model;

import java.util.List;

/**
 * crossover 當下兩人的第一則訊息
 * - first：較早開始的那一方（可能已有多則）
 * - second：觸發 crossover 的那一方的第一則
 * - children：program owner 填的小孩數，沒填就看另一方；都沒填是 null
 */
public record StepResponseContext(
        Long stepId,
        int day,
        String theme,
        String conversationStarter,
        String scienceBehindIt,
        String firstName,
        List<String> firstMessages,
        String secondName,
        String secondFirstMessage,
        Integer children
) {}
