package com.couplesync.backend.program.dto;

import com.couplesync.backend.program.entity.ProgramStep;

import java.time.Instant;

public record ProgramStepDto(
        Long id,
        Long programId,
        int day,
        String theme,
        String conversationStarter,
        String scienceBehindIt,
        boolean started,
        Instant startedAt,
        boolean responseTriggered
) {
    public static ProgramStepDto from(ProgramStep s) {
        return new ProgramStepDto(
                s.getId(), s.getProgramId(), s.getDay(), s.getTheme(), s.getConversationStarter(),
                s.getScienceBehindIt(), s.isStarted(), s.getStartedAt(), s.getResponseTriggeredAt() != null
        );
    }
}
