package com.couplesync.backend.program.dto;

import com.couplesync.backend.program.entity.PlanStatus;
import com.couplesync.backend.program.entity.Program;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgramDto(
        Long id,
        Long ownerId,
        Long pairingId,
        Long previousProgramId,
        String userInput,
        String title,
        String overview,
        PlanStatus planStatus,
        String generationError,
        UnlockStatus unlock,
        Instant createdAt,
        List<ProgramStepDto> steps
) {
    public static ProgramDto from(Program p, UnlockStatus unlock) {
        return from(p, unlock, null);
    }

    public static ProgramDto from(Program p, UnlockStatus unlock, List<ProgramStepDto> steps) {
        return new ProgramDto(
                p.getId(), p.getUserId(), p.getPairingId(), p.getPreviousProgramId(), p.getUserInput(),
                p.getTitle(), p.getOverview(), p.getPlanStatus(), p.getGenerationError(),
                unlock, p.getCreatedAt(), steps
        );
    }
}
