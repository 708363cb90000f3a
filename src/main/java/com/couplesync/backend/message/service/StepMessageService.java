package com.couplesync.backend.message.service;

import com.couplesync.backend.common.error.DomainException;
import com.couplesync.backend.contribution.service.ContributionTracker;
import com.couplesync.backend.generation.safety.PromptSanitizer;
import com.couplesync.backend.message.dto.PostMessageResult;
import com.couplesync.backend.message.dto.StepMessageDto;
import com.couplesync.backend.message.entity.MessageType;
import com.couplesync.backend.message.entity.StepMessage;
import com.couplesync.backend.message.repo.StepMessageRepository;
import com.couplesync.backend.program.service.ProgramService;
import com.couplesync.backend.program.service.StepAccess;
import com.couplesync.backend.trigger.service.StepResponseTrigger;
import com.couplesync.backend.trigger.service.TriggerOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class StepMessageService {

    private final StepMessageRepository repo;
    private final ProgramService programService;
    private final ContributionTracker contributionTracker;
    private final StepResponseTrigger trigger;
    private final Clock clock;

    /**
     * 存訊息 → step started → 檢查解鎖 → crossover 判斷
     * 整段在同一個 transaction，step row 從頭鎖到 commit
     */
    @Transactional
    public PostMessageResult post(Long userId, Long stepId, String rawContent) {
        String text = requireContent(rawContent);
        StepAccess access = programService.requireStepAccess(userId, stepId, true);

        StepMessage m = new StepMessage();
        m.setStepId(stepId);
        m.setSenderId(userId);
        m.setMessageType(MessageType.USER_MESSAGE);
        m.setContent(text);
        m.setCreatedAt(clock.instant());
        StepMessage saved = repo.save(m);

        boolean started = contributionTracker.markStepStarted(stepId) || access.step().isStarted();
        boolean unlocked = contributionTracker.refreshUnlockFlag(access.program());
        TriggerOutcome outcome = trigger.onUserMessage(access, userId);

        log.info("step_message_posted stepId={} messageId={} userId={} trigger={}", stepId, saved.getId(), userId, outcome);
        return new PostMessageResult(StepMessageDto.from(saved), started, unlocked, outcome);
    }

    @Transactional(readOnly = true)
    public List<StepMessageDto> list(Long userId, Long stepId) {
        programService.requireStepAccess(userId, stepId, false);
        return repo.findByStepIdOrderByIdAsc(stepId).stream().map(StepMessageDto::from).toList();
    }

    /** 只能改自己的 user message；不影響 contribution / trigger */
    @Transactional
    public StepMessageDto edit(Long userId, Long stepId, Long messageId, String rawContent) {
        String text = requireContent(rawContent);
        programService.requireStepAccess(userId, stepId, false);

        StepMessage m = repo.findById(messageId)
                .filter(x -> Objects.equals(x.getStepId(), stepId))
                .orElseThrow(() -> DomainException.notFound("MESSAGE_NOT_FOUND"));
        if (m.getMessageType() != MessageType.USER_MESSAGE || !Objects.equals(m.getSenderId(), userId)) {
            throw DomainException.forbidden("MESSAGE_FORBIDDEN");
        }

        m.setContent(text);
        m.setUpdatedAt(clock.instant());
        log.info("step_message_edited stepId={} messageId={} userId={}", stepId, messageId, userId);
        return StepMessageDto.from(m);
    }

    private static String requireContent(String raw) {
        if (raw == null || raw.isBlank()) throw DomainException.invalid("MESSAGE_CONTENT_REQUIRED");
        if (raw.length() > PromptSanitizer.MAX_LEN) throw DomainException.invalid("MESSAGE_TOO_LONG");

        String text = PromptSanitizer.sanitize(raw);
        if (text.isBlank()) throw DomainException.invalid("MESSAGE_CONTENT_REQUIRED");
        return text;
    }
}
