package com.couplesync.backend.generation.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * ✅ 本機 / test 用：不打外部 API，回固定但「合法」的輸出
 */
public class StubGenerationClient implements GenerationClient {

    static final int PLAN_DAYS = 14;

    private final ObjectMapper om;

    public StubGenerationClient(ObjectMapper om) {
        this.om = om;
    }

    @Override
    public String providerCode() { return "STUB"; }

    @Override
    public String complete(GenerationRequest request) {
        try {
            return switch (request.purpose()) {
                case PROGRAM_PLAN -> om.writeValueAsString(plan());
                case STEP_RESPONSE -> om.writeValueAsString(stepResponse());
            };
        } catch (JsonProcessingException e) {
            throw new GenerationException("GENERATION_STUB_FAILED", e);
        }
    }

    private ObjectNode plan() {
        ObjectNode root = om.createObjectNode();
        ObjectNode program = root.putObject("program");
        program.put("title", "14-Day Emotional Connection Program");
        program.put("overview", "Two weeks of short daily conversations that help you and your partner feel closer.");

        ArrayNode days = program.putArray("days");
        for (int i = 1; i <= PLAN_DAYS; i++) {
            days.addObject()
                    .put("day", i)
                    .put("theme", "Connection theme " + i)
                    .put("conversation_starter", "Day " + i + ": share one moment this week when you felt connected to your partner.")
                    .put("science_behind_it", "Talking about small moments of connection helps couples build trust and "
                                              + "strengthens the emotional bond over time.");
        }
        return root;
    }

    private ObjectNode stepResponse() {
        ObjectNode root = om.createObjectNode();
        ArrayNode messages = root.putArray("messages");
        messages.add("Thank you both for opening up today. It takes courage to share how you feel with your partner.");
        messages.add("Notice where your answers overlap: you both care about feeling heard and supported in the relationship.");
        messages.add("Before tomorrow, try telling each other one thing you appreciated about today's conversation.");
        return root;
    }
}
