package com.couplesync.backend.generation.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 模型回傳的 14 天計畫：{"program": {title, overview, days[]}}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProgramPlan(
        String title,
        String overview,
        List<PlanDay> days
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PlanDay(
            int day,
            String theme,
            @JsonProperty("conversation_starter") String conversationStarter,
            @JsonProperty("science_behind_it") String scienceBehindIt
    ) {}
}
