package com.couplesync.backend.generation.service;

import com.couplesync.backend.generation.client.GenerationClient;
import com.couplesync.backend.generation.client.GenerationException;
import com.couplesync.backend.generation.client.GenerationRequest;
import com.couplesync.backend.generation.model.ProgramPlan;
import com.couplesync.backend.generation.model.StepResponseContext;
import com.couplesync.backend.generation.safety.GenerationOutputValidator;
import com.couplesync.backend.generation.safety.PromptSanitizer;
import com.couplesync.backend.program.config.ProgramProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * prompt 組裝 + 輸出解析
 * 所有使用者文字都先經過 PromptSanitizer，所有模型輸出都先經過 GenerationOutputValidator
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentGenerationService {

    private static final String PLAN_SYSTEM_PROMPT =
            "You are a professional couples therapist. You must respond only with valid JSON in the specified format. "
            + "Do not include any text outside the JSON structure. Focus only on therapeutic content.";

    private static final String STEP_SYSTEM_PROMPT =
            "You are a warm, research-informed couples therapist guiding a daily conversation. "
            + "Respond only with JSON of the form {\"messages\": [\"...\", \"...\"]}. Focus only on therapeutic content.";

    private final GenerationClient client;
    private final ObjectMapper om;
    private final ProgramProperties programProps;

    /**
     * @param previousStarters 上一期有人回應過的 conversation starters（第一期為空）
     */
    public ProgramPlan generatePlan(String userName, String partnerName, String seed,
                                    List<String> previousStarters, String refId) {
        String user = PromptSanitizer.sanitize(defaultName(userName, "Partner A"));
        String partner = PromptSanitizer.sanitize(defaultName(partnerName, "Partner B"));
        String input = PromptSanitizer.sanitize(seed);

        if (PromptSanitizer.isSuspicious(input) || PromptSanitizer.isSuspicious(user) || PromptSanitizer.isSuspicious(partner)) {
            throw new GenerationException("GENERATION_UNSAFE_INPUT");
        }
        if (user.length() > 50 || partner.length() > 50) throw new GenerationException("GENERATION_INVALID_INPUT");
        if (input.length() < 10) throw new GenerationException("GENERATION_INVALID_INPUT");

        int days = programProps.getPlanDays();
        String prompt = planPrompt(user, partner, input, days);
        if (previousStarters != null && !previousStarters.isEmpty()) {
            StringBuilder sb = new StringBuilder(prompt)
                    .append("\nIn their previous program they already talked about these conversation starters. ")
                    .append("Build on them and do not repeat them:\n");
            for (String st : previousStarters) {
                sb.append("- ").append(PromptSanitizer.sanitize(st)).append('\n');
            }
            prompt = sb.toString();
        }

        String text = client.complete(new GenerationRequest(
                GenerationRequest.Purpose.PROGRAM_PLAN, refId, PLAN_SYSTEM_PROMPT, prompt));
        GenerationOutputValidator.requireSafeResponse(text);

        ProgramPlan plan;
        try {
            JsonNode root = om.readTree(stripFence(text));
            plan = om.treeToValue(root.path("program"), ProgramPlan.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("generation_plan_parse_failed refId={} err={}", refId, e.getClass().getSimpleName());
            throw new GenerationException("GENERATION_INVALID_PLAN", e);
        }

        GenerationOutputValidator.requireValidPlan(plan, days);
        return plan;
    }

    /**
     * @return 依模型回傳順序排列的訊息（至少一則）
     */
    public List<String> generateStepResponse(StepResponseContext ctx) {
        String first = PromptSanitizer.sanitize(defaultName(ctx.firstName(), "Partner A"));
        String second = PromptSanitizer.sanitize(defaultName(ctx.secondName(), "Partner B"));

        StringBuilder p = new StringBuilder();
        p.append("Today is day ").append(ctx.day()).append(" of a couples program. Theme: ")
                .append(PromptSanitizer.sanitize(ctx.theme())).append(".\n")
                .append("Conversation starter: \"").append(PromptSanitizer.sanitize(ctx.conversationStarter())).append("\"\n");
        if (ctx.scienceBehindIt() != null && !ctx.scienceBehindIt().isBlank()) {
            p.append("Why this step matters: ").append(PromptSanitizer.sanitize(ctx.scienceBehindIt())).append('\n');
        }
        if (ctx.children() != null) {
            p.append(ctx.children() == 0
                    ? "The couple has no children.\n"
                    : "The couple is raising " + ctx.children() + (ctx.children() == 1 ? " child" : " children")
                      + "; keep suggestions realistic for a busy family.\n");
        }
        p.append('\n').append(first).append(" wrote:\n");
        for (String m : ctx.firstMessages()) {
            p.append("- \"").append(PromptSanitizer.sanitize(m)).append("\"\n");
        }
        p.append('\n').append(second).append(" wrote:\n- \"")
                .append(PromptSanitizer.sanitize(ctx.secondFirstMessage())).append("\"\n\n")
                .append("Reflect back what each of them shared, highlight where they connect, and suggest one small next step. ")
                .append("Use both names. Reply with 2 to 4 short messages.");

        String text = client.complete(new GenerationRequest(
                GenerationRequest.Purpose.STEP_RESPONSE, String.valueOf(ctx.stepId()), STEP_SYSTEM_PROMPT, p.toString()));
        GenerationOutputValidator.requireSafeResponse(text);

        List<String> out = parseMessages(text);
        if (out.isEmpty()) throw new GenerationException("GENERATION_EMPTY_RESPONSE");
        return out;
    }

    /** 優先吃 {"messages": [...]}；不是 JSON 就用空行切段落 */
    List<String> parseMessages(String text) {
        String body = stripFence(text);
        List<String> out = new ArrayList<>();
        try {
            JsonNode arr = om.readTree(body).path("messages");
            if (arr.isArray()) {
                for (JsonNode n : arr) {
                    if (n.isTextual() && !n.asText().isBlank()) out.add(n.asText().trim());
                }
                return out;
            }
        } catch (JsonProcessingException e) {
            log.debug("generation_step_not_json fallback=paragraphs");
        }
        for (String part : body.split("\\n\\s*\\n")) {
            if (!part.isBlank()) out.add(part.trim());
        }
        return out;
    }

    private static String planPrompt(String user, String partner, String input, int days) {
        return """
                A couple comes into your therapy room. Their names are %1$s and %2$s.

                %1$s says the following to you:

                "%3$s"

                Your goal is to help them talk every day for %4$d consecutive days so they can work through their \
                primary issue and experience greater emotional connection together.

                Provide 1 conversation starter per day for %4$d days. Each one builds on the one before it, has its own \
                theme, gives both people an equal chance to share their perspective, and feels light and conversational. \
                For each day, explain the research behind it in accessible language, speaking directly to the couple.

                Format the response as a JSON object:
                {
                  "program": {
                    "title": "%4$d-Day Emotional Connection Program for %1$s and %2$s",
                    "overview": "Brief description of the program goals",
                    "days": [
                      {"day": 1, "theme": "Theme name", "conversation_starter": "...", "science_behind_it": "..."}
                    ]
                  }
                }
                """.formatted(user, partner, input, days);
    }

    private static String stripFence(String text) {
        String t = text.trim();
        if (t.startsWith("```")) {
            int nl = t.indexOf('\n');
            int end = t.lastIndexOf("```");
            if (nl > 0 && end > nl) return t.substring(nl + 1, end).trim();
        }
        return t;
    }

    private static String defaultName(String name, String fallback) {
        return (name == null || name.isBlank()) ? fallback : name;
    }
}
