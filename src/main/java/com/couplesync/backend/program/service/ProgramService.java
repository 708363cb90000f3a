package com.couplesync.backend.program.service;

import com.couplesync.backend.common.error.DomainException;
import com.couplesync.backend.common.tx.AfterCommit;
import com.couplesync.backend.contribution.service.ContributionTracker;
import com.couplesync.backend.generation.safety.PromptSanitizer;
import com.couplesync.backend.pairing.entity.Pairing;
import com.couplesync.backend.pairing.service.PairingService;
import com.couplesync.backend.program.config.ProgramProperties;
import com.couplesync.backend.program.dto.CreateProgramRequest;
import com.couplesync.backend.program.dto.NextProgramRequest;
import com.couplesync.backend.program.dto.ProgramDto;
import com.couplesync.backend.program.dto.ProgramStepDto;
import com.couplesync.backend.program.entity.PlanStatus;
import com.couplesync.backend.program.entity.Program;
import com.couplesync.backend.program.entity.ProgramStep;
import com.couplesync.backend.program.repo.ProgramRepository;
import com.couplesync.backend.program.repo.ProgramStepRepository;
import com.couplesync.backend.users.user.entity.User;
import com.couplesync.backend.users.user.repo.UserRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * program 建立 / 下一期 / 查詢 / 刪除 + step 存取檢查
 * 存取規則：owner，或 program 所屬 accepted pairing 的任一方
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProgramService {

    static final int MIN_INPUT_LEN = 10;

    private final ProgramRepository programs;
    private final ProgramStepRepository steps;
    private final PairingService pairingService;
    private final ContributionTracker contributionTracker;
    private final ProgramPlanGenerator planGenerator;
    private final ProgramProperties props;
    private final UserRepo userRepo;
    private final Clock clock;

    @Transactional
    public ProgramDto create(Long userId, CreateProgramRequest req) {
        User owner = requireUser(userId);
        String seed = requireSeed(req.userInput());

        Long pairingId = null;
        String partnerName = owner.getPartnerName();
        if (req.pairingId() != null) {
            Pairing pairing = pairingService.findActiveAccepted(req.pairingId())
                    .orElseThrow(() -> DomainException.notFound("PAIRING_NOT_FOUND"));
            if (!pairing.isParticipant(userId)) throw DomainException.forbidden("PAIRING_FORBIDDEN");
            pairingId = pairing.getId();
            partnerName = resolvePartnerName(owner, pairing);
        }
        requireNames(owner.getUserName(), partnerName);
        int required = requiredSteps(req.stepsRequiredForUnlock());

        Program saved = programs.save(newProgram(userId, pairingId, seed, null, required));
        log.info("program_created programId={} userId={} pairingId={}", saved.getId(), userId, pairingId);

        schedulePlan(new PlanJob(saved.getId(), owner.getUserName(), partnerName, seed, List.of()));
        return ProgramDto.from(saved, contributionTracker.unlockStatus(saved));
    }

    /**
     * 上一期解鎖後才能開下一期；沿用上一期的 pairing（若仍有效）
     */
    @Transactional
    public ProgramDto createNext(Long userId, Long previousProgramId, NextProgramRequest req) {
        User owner = requireUser(userId);
        Program previous = requireAccessible(userId, previousProgramId);

        if (!contributionTracker.refreshUnlockFlag(previous)) {
            throw DomainException.conflict("PROGRAM_LOCKED");
        }
        String seed = requireSeed(req.userInput());

        Pairing pairing = pairingService.findActiveAccepted(previous.getPairingId())
                .filter(p -> p.isParticipant(userId))
                .orElse(null);
        String partnerName = (pairing == null) ? owner.getPartnerName() : resolvePartnerName(owner, pairing);
        requireNames(owner.getUserName(), partnerName);

        List<String> previousStarters = steps.findStartersWithUserMessages(previous.getId());

        Long pairingId = (pairing == null) ? null : pairing.getId();
        // 門檻沿用上一期
        Program saved = programs.save(newProgram(userId, pairingId, seed, previous.getId(), previous.getStepsRequiredForUnlock()));
        log.info("program_next_created programId={} previousProgramId={} userId={} carriedStarters={}",
                saved.getId(), previous.getId(), userId, previousStarters.size());

        schedulePlan(new PlanJob(saved.getId(), owner.getUserName(), partnerName, seed, previousStarters));
        return ProgramDto.from(saved, contributionTracker.unlockStatus(saved));
    }

    /**
     * 生成失敗後手動重跑：只有 FAILED 且一個 step 都沒有才行
     * 已經有 step 的 program 要重來就刪掉再建
     */
    @Transactional
    public ProgramDto regeneratePlan(Long userId, Long programId) {
        Program p = requireAccessible(userId, programId);
        if (steps.countByProgramId(programId) > 0) throw DomainException.conflict("PLAN_ALREADY_EXISTS");
        if (p.getPlanStatus() != PlanStatus.FAILED) throw DomainException.conflict("PLAN_NOT_FAILED");

        User owner = requireUser(p.getUserId());
        Pairing pairing = pairingService.findActiveAccepted(p.getPairingId()).orElse(null);
        String partnerName = (pairing == null) ? owner.getPartnerName() : resolvePartnerName(owner, pairing);
        requireNames(owner.getUserName(), partnerName);

        // FAILED → GENERATING 的 CAS：同時按兩次只有一次會排進去
        if (programs.restartGeneration(programId) == 0) throw DomainException.conflict("PLAN_NOT_FAILED");

        List<String> previousStarters = (p.getPreviousProgramId() == null)
                ? List.of()
                : steps.findStartersWithUserMessages(p.getPreviousProgramId());
        log.info("program_plan_regenerating programId={} userId={} previousError={}",
                programId, userId, p.getGenerationError());

        schedulePlan(new PlanJob(programId, owner.getUserName(), partnerName, p.getUserInput(), previousStarters));
        p.setPlanStatus(PlanStatus.GENERATING);
        p.setGenerationError(null);
        return ProgramDto.from(p, contributionTracker.unlockStatus(p));
    }

    @Transactional(readOnly = true)
    public List<ProgramDto> list(Long userId) {
        return programs.findAccessible(userId).stream()
                .map(p -> ProgramDto.from(p, contributionTracker.unlockStatus(p)))
                .toList();
    }

    @Transactional(readOnly = true)
    public ProgramDto get(Long userId, Long programId) {
        Program p = requireAccessible(userId, programId);
        return ProgramDto.from(p, contributionTracker.unlockStatus(p), listSteps(p.getId()));
    }

    @Transactional(readOnly = true)
    public List<ProgramStepDto> steps(Long userId, Long programId) {
        requireAccessible(userId, programId);
        return listSteps(programId);
    }

    @Transactional(readOnly = true)
    public ProgramStepDto step(Long userId, Long stepId) {
        return ProgramStepDto.from(requireStepAccess(userId, stepId, false).step());
    }

    /** 只有 owner 能刪；partner 看得到但刪不掉 */
    @Transactional
    public void delete(Long userId, Long programId) {
        Program p = requireAccessible(userId, programId);
        if (!Objects.equals(p.getUserId(), userId)) throw DomainException.forbidden("PROGRAM_FORBIDDEN");

        int n = programs.softDeleteByOwner(programId, userId, clock.instant());
        if (n == 0) throw DomainException.notFound("PROGRAM_NOT_FOUND");
        log.info("program_deleted programId={} userId={}", programId, userId);
    }

    // ===== access =====

    @Transactional(readOnly = true)
    public Program requireAccessible(Long userId, Long programId) {
        Program p = programs.findActiveById(programId)
                .orElseThrow(() -> DomainException.notFound("PROGRAM_NOT_FOUND"));
        if (Objects.equals(p.getUserId(), userId)) return p;

        boolean viaPairing = pairingService.findActiveAccepted(p.getPairingId())
                .map(pr -> pr.isParticipant(userId))
                .orElse(false);
        if (!viaPairing) throw DomainException.forbidden("PROGRAM_FORBIDDEN");
        return p;
    }

    /**
     * @param forUpdate true：step row 上 PESSIMISTIC_WRITE，同一 step 的發言在這裡排隊
     */
    @Transactional
    public StepAccess requireStepAccess(Long userId, Long stepId, boolean forUpdate) {
        ProgramStep step = (forUpdate ? steps.findByIdForUpdate(stepId) : steps.findById(stepId))
                .orElseThrow(() -> DomainException.notFound("STEP_NOT_FOUND"));
        Program program = requireAccessible(userId, step.getProgramId());
        Pairing pairing = pairingService.findActiveAccepted(program.getPairingId()).orElse(null);
        return new StepAccess(step, program, pairing);
    }

    // ===== helpers =====

    private void schedulePlan(PlanJob job) {
        AfterCommit.run(() -> planGenerator.schedule(job));
    }

    private Program newProgram(Long userId, Long pairingId, String seed, Long previousProgramId, int required) {
        Program p = new Program();
        p.setUserId(userId);
        p.setPairingId(pairingId);
        p.setUserInput(seed);
        p.setPreviousProgramId(previousProgramId);
        p.setPlanStatus(PlanStatus.GENERATING);
        p.setStepsRequiredForUnlock(required);
        p.setCreatedAt(clock.instant());
        return p;
    }

    private int requiredSteps(Integer requested) {
        if (requested == null) return props.getStepsRequiredForUnlock();
        if (requested < 1 || requested > props.getPlanDays()) {
            throw DomainException.invalid("STEPS_REQUIRED_OUT_OF_RANGE");
        }
        return requested;
    }

    private List<ProgramStepDto> listSteps(Long programId) {
        return steps.findByProgramIdOrderByDayAsc(programId).stream().map(ProgramStepDto::from).toList();
    }

    private User requireUser(Long userId) {
        return userRepo.findActiveById(userId)
                .orElseThrow(() -> DomainException.notFound("USER_NOT_FOUND"));
    }

    /** partnerName 沒填就用對方帳號的 userName */
    private String resolvePartnerName(User owner, Pairing pairing) {
        if (owner.getPartnerName() != null && !owner.getPartnerName().isBlank()) return owner.getPartnerName();
        Long otherId = pairing.otherParty(owner.getId());
        return (otherId == null) ? null : userRepo.findActiveById(otherId).map(User::getUserName).orElse(null);
    }

    private static String requireSeed(String raw) {
        if (raw == null) throw DomainException.invalid("PROGRAM_INPUT_REQUIRED");
        if (PromptSanitizer.isSuspicious(raw)) throw DomainException.invalid("UNSAFE_INPUT");

        String seed = PromptSanitizer.sanitize(raw);
        if (seed.length() < MIN_INPUT_LEN || seed.length() > PromptSanitizer.MAX_LEN) {
            throw DomainException.invalid("PROGRAM_INPUT_LENGTH");
        }
        return seed;
    }

    private static void requireNames(String userName, String partnerName) {
        if (userName == null || userName.isBlank() || partnerName == null || partnerName.isBlank()) {
            throw DomainException.invalid("USER_NAMES_REQUIRED");
        }
    }
}
