package com.couplesync.backend.message.dto;

import com.couplesync.backend.message.entity.MessageType;
import com.couplesync.backend.message.entity.StepMessage;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonRawValue;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StepMessageDto(
        Long id,
        Long stepId,
        Long senderId,
        MessageType messageType,
        String content,
        @JsonRawValue String metadata,
        Instant createdAt,
        Instant updatedAt
) {
    public static StepMessageDto from(StepMessage m) {
        return new StepMessageDto(
                m.getId(), m.getStepId(), m.getSenderId(), m.getMessageType(), m.getContent(),
                m.getMetadata(), m.getCreatedAt(), m.getUpdatedAt()
        );
    }
}
