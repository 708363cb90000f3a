package com.couplesync.backend.generation.safety;

import com.couplesync.backend.generation.client.GenerationException;
import com.couplesync.backend.generation.model.ProgramPlan;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 模型輸出在落地前的檢查：長度、洩漏的控制 token、計畫結構
 */
@Slf4j
public final class GenerationOutputValidator {

    public static final int MIN_RESPONSE_LEN = 100;

    private static final List<Pattern> DANGEROUS = List.of(
            Pattern.compile("ignore\\s+previous\\s+instructions", Pattern.CASE_INSENSITIVE),
            Pattern.compile("i'm\\s+not\\s+a\\s+therapist", Pattern.CASE_INSENSITIVE),
            Pattern.compile("as\\s+an\\s+ai\\s+language\\s+model", Pattern.CASE_INSENSITIVE),
            Pattern.compile("i\\s+cannot\\s+provide\\s+therapy", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\[/?INST\\]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<\\|.*?\\|>"),
            Pattern.compile("system\\s*:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("assistant\\s*:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("human\\s*:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("developer\\s*mode", Pattern.CASE_INSENSITIVE),
            Pattern.compile("jailbreak", Pattern.CASE_INSENSITIVE),
            Pattern.compile("override", Pattern.CASE_INSENSITIVE)
    );

    private static final List<Pattern> TOPIC_KEYWORDS = List.of(
            Pattern.compile("relationship", Pattern.CASE_INSENSITIVE),
            Pattern.compile("couple", Pattern.CASE_INSENSITIVE),
            Pattern.compile("partner", Pattern.CASE_INSENSITIVE),
            Pattern.compile("communicat", Pattern.CASE_INSENSITIVE),
            Pattern.compile("emotion", Pattern.CASE_INSENSITIVE),
            Pattern.compile("feeling", Pattern.CASE_INSENSITIVE),
            Pattern.compile("connect", Pattern.CASE_INSENSITIVE),
            Pattern.compile("bond", Pattern.CASE_INSENSITIVE),
            Pattern.compile("love", Pattern.CASE_INSENSITIVE),
            Pattern.compile("trust", Pattern.CASE_INSENSITIVE)
    );

    private GenerationOutputValidator() {}

    /**
     * @throws GenerationException GENERATION_UNSAFE_OUTPUT / GENERATION_OUTPUT_TOO_SHORT
     */
    public static void requireSafeResponse(String response) {
        if (response == null || response.length() < MIN_RESPONSE_LEN) {
            // 太短多半是拒答
            log.warn("security_ai_response_too_short len={}", response == null ? 0 : response.length());
            throw new GenerationException("GENERATION_OUTPUT_TOO_SHORT");
        }
        for (Pattern p : DANGEROUS) {
            if (p.matcher(response).find()) {
                log.warn("security_ai_response_rejected pattern={}", p.pattern());
                throw new GenerationException("GENERATION_UNSAFE_OUTPUT");
            }
        }
    }

    /**
     * @throws GenerationException GENERATION_INVALID_PLAN
     */
    public static void requireValidPlan(ProgramPlan plan, int expectedDays) {
        if (plan == null || isBlank(plan.title()) || plan.days() == null) throw invalidPlan("missing title/days");
        if (plan.days().size() != expectedDays) throw invalidPlan("days=" + plan.days().size());

        for (int i = 0; i < plan.days().size(); i++) {
            ProgramPlan.PlanDay d = plan.days().get(i);
            if (d == null || d.day() != i + 1) throw invalidPlan("day order at index " + i);
            if (!lengthBetween(d.theme(), 5, 200)) throw invalidPlan("theme length day " + d.day());
            if (!lengthBetween(d.conversationStarter(), 20, 1000)) throw invalidPlan("starter length day " + d.day());
            if (!lengthBetween(d.scienceBehindIt(), 50, 2000)) throw invalidPlan("science length day " + d.day());

            boolean onTopic = TOPIC_KEYWORDS.stream().anyMatch(p ->
                    p.matcher(d.conversationStarter()).find() || p.matcher(d.scienceBehindIt()).find());
            if (!onTopic) throw invalidPlan("off-topic day " + d.day());
        }
    }

    private static GenerationException invalidPlan(String why) {
        log.warn("security_ai_plan_rejected reason={}", why);
        return new GenerationException("GENERATION_INVALID_PLAN");
    }

    private static boolean lengthBetween(String s, int min, int max) {
        return s != null && s.length() >= min && s.length() <= max;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
