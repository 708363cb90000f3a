package com.couplesync.backend.trigger.service;

import com.couplesync.backend.common.error.DomainException;
import com.couplesync.backend.common.tx.AfterCommit;
import com.couplesync.backend.contribution.service.ContributionTracker;
import com.couplesync.backend.generation.model.StepResponseContext;
import com.couplesync.backend.generation.service.ContentGenerationService;
import com.couplesync.backend.message.entity.MessageType;
import com.couplesync.backend.message.entity.StepMessage;
import com.couplesync.backend.message.repo.StepMessageRepository;
import com.couplesync.backend.message.service.StepMessageWriter;
import com.couplesync.backend.pairing.entity.Pairing;
import com.couplesync.backend.program.entity.ProgramStep;
import com.couplesync.backend.program.repo.ProgramStepRepository;
import com.couplesync.backend.program.service.StepAccess;
import com.couplesync.backend.users.user.entity.User;
import com.couplesync.backend.users.user.repo.UserRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 兩人都在同一 step 第一次發言的那一刻（crossover）觸發 AI 回應，且只觸發一次
 *
 * 併發策略：
 * - 呼叫端已對 step row 拿 PESSIMISTIC_WRITE，兩人的第一則發言在 DB 上排隊，
 *   後到的一定看得到先到的 contribution，所以不會漏觸發
 * - response_triggered_at IS NULL 的 compare-and-set 只有一個 request 會拿到 1，所以不會重複觸發
 * - 生成在 commit 之後丟到 generationExecutor，HTTP response 不等它
 */
@Slf4j
@Service
public class StepResponseTrigger {

    private final ContributionTracker contributions;
    private final ProgramStepRepository steps;
    private final StepMessageRepository messages;
    private final StepMessageWriter writer;
    private final ContentGenerationService content;
    private final UserRepo userRepo;
    private final TaskExecutor executor;
    private final Clock clock;

    public StepResponseTrigger(ContributionTracker contributions,
                               ProgramStepRepository steps,
                               StepMessageRepository messages,
                               StepMessageWriter writer,
                               ContentGenerationService content,
                               UserRepo userRepo,
                               @Qualifier("generationExecutor") TaskExecutor executor,
                               Clock clock) {
        this.contributions = contributions;
        this.steps = steps;
        this.messages = messages;
        this.writer = writer;
        this.content = content;
        this.userRepo = userRepo;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * 在 user message 已存好、同一個 transaction 內呼叫
     * @param access 必須是 requireStepAccess(..., forUpdate=true) 拿到的
     */
    @Transactional
    public TriggerOutcome onUserMessage(StepAccess access, Long userId) {
        Pairing pairing = access.acceptedPairing()
                .filter(p -> p.isParticipant(userId))
                .orElse(null);
        if (pairing == null) return TriggerOutcome.NOT_PAIRED;

        ProgramStep step = access.step();
        Long stepId = step.getId();

        if (!contributions.recordFirstContribution(stepId, userId)) {
            return TriggerOutcome.REPEAT_CONTRIBUTION;
        }

        Long partnerId = pairing.otherParty(userId);
        if (partnerId == null || !contributions.hasContributed(stepId, partnerId)) {
            log.info("step_waiting_for_partner stepId={} userId={}", stepId, userId);
            return TriggerOutcome.WAITING_FOR_PARTNER;
        }

        if (steps.markResponseTriggered(stepId, clock.instant()) == 0) {
            log.warn("step_response_already_fired stepId={} userId={}", stepId, userId);
            return TriggerOutcome.ALREADY_FIRED;
        }

        StepResponseContext ctx = buildContext(access, partnerId, userId);
        log.info("step_response_fired stepId={} firstUserId={} secondUserId={}", stepId, partnerId, userId);
        AfterCommit.run(() -> submit(ctx));
        return TriggerOutcome.FIRED;
    }

    private void submit(StepResponseContext ctx) {
        try {
            executor.execute(() -> generate(ctx));
        } catch (RuntimeException e) {
            log.warn("step_response_failed stepId={} code=GENERATION_REJECTED err={}",
                    ctx.stepId(), e.getClass().getSimpleName());
        }
    }

    /** 不重試；錯誤只進 log */
    void generate(StepResponseContext ctx) {
        long t0 = System.nanoTime();
        try {
            List<String> texts = content.generateStepResponse(ctx);
            int n = writer.appendSystemMessages(ctx.stepId(), texts);
            log.info("step_response_done stepId={} messages={} latencyMs={}",
                    ctx.stepId(), n, (System.nanoTime() - t0) / 1_000_000);
        } catch (DomainException e) {
            log.warn("step_response_failed stepId={} code={}", ctx.stepId(), e.code());
        } catch (RuntimeException e) {
            log.warn("step_response_failed stepId={} code=FAILED err={}", ctx.stepId(), e.getClass().getSimpleName(), e);
        }
    }

    private StepResponseContext buildContext(StepAccess access, Long firstUserId, Long secondUserId) {
        ProgramStep step = access.step();
        User first = userRepo.findActiveById(firstUserId).orElse(null);
        User second = userRepo.findActiveById(secondUserId).orElse(null);

        List<String> firstMessages = userMessages(step.getId(), firstUserId);
        List<String> secondMessages = userMessages(step.getId(), secondUserId);
        String secondFirst = secondMessages.isEmpty() ? "" : secondMessages.get(0);

        return new StepResponseContext(
                step.getId(),
                step.getDay(),
                step.getTheme(),
                step.getConversationStarter(),
                step.getScienceBehindIt(),
                nameOf(first),
                firstMessages,
                nameOf(second),
                secondFirst,
                childrenOf(access.program().getUserId(), first, second)
        );
    }

    private List<String> userMessages(Long stepId, Long senderId) {
        return messages.findByStepIdAndSenderIdAndMessageTypeOrderByIdAsc(stepId, senderId, MessageType.USER_MESSAGE)
                .stream().map(StepMessage::getContent).toList();
    }

    private static String nameOf(User u) {
        return (u == null) ? null : u.getUserName();
    }

    private static Integer childrenOf(Long ownerId, User first, User second) {
        List<User> byPriority = (second != null && Objects.equals(second.getId(), ownerId))
                ? Arrays.asList(second, first)
                : Arrays.asList(first, second);
        return byPriority.stream()
                .filter(Objects::nonNull)
                .map(User::getChildren)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
    }
}
