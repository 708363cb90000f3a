package com.couplesync.backend.pairing.service;

import com.couplesync.backend.common.error.DomainException;
import com.couplesync.backend.pairing.dto.PairingCodeDto;
import com.couplesync.backend.pairing.dto.PairingDto;
import com.couplesync.backend.pairing.dto.PairingStats;
import com.couplesync.backend.pairing.entity.Pairing;
import com.couplesync.backend.pairing.entity.PairingStatus;
import com.couplesync.backend.pairing.repo.PairingRepository;
import com.couplesync.backend.users.user.entity.User;
import com.couplesync.backend.users.user.repo.UserRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * pairing 狀態機：pending → accepted / rejected（只轉一次），soft delete 可還原
 * 查詢預設不含已刪除，要看已刪除用 *IncludingDeleted
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PairingService {

    private final PairingRepository repo;
    private final UserRepo userRepo;
    private final PartnerCodeGenerator codeGenerator;
    private final Clock clock;

    @Transactional
    public PairingCodeDto requestPairing(Long userId) {
        // 鎖 user row：同一人的 request / accept 排隊，配額檢查才不會被併發穿透
        User user = lockUser(userId);

        if (repo.countAccepted(userId) >= user.getMaxPairings()) {
            throw DomainException.conflict("QUOTA_EXCEEDED");
        }
        if (repo.countOpenRequests(userId) > 0) {
            throw DomainException.conflict("DUPLICATE_PENDING_REQUEST");
        }

        String code = codeGenerator.generate(c -> !repo.existsByPartnerCode(c));

        Pairing p = new Pairing();
        p.setRequesterId(userId);
        p.setPartnerCode(code);
        p.setStatus(PairingStatus.PENDING);
        p.setCreatedAt(clock.instant());
        Pairing saved = repo.save(p);

        log.info("pairing_requested pairingId={} requesterId={}", saved.getId(), userId);
        return new PairingCodeDto(saved.getId(), code);
    }

    @Transactional
    public PairingDto acceptByCode(Long acceptorId, String rawCode) {
        String code = normalizeCode(rawCode);
        if (!PartnerCodeGenerator.isWellFormed(code)) throw DomainException.notFound("PAIRING_CODE_NOT_FOUND");

        // 鎖序：pairing row → user row（小 id 先）；前面都是 locking read，後面的 count 才會看到最新 commit
        Pairing pending = repo.findPendingByCodeForUpdate(code)
                .orElseThrow(() -> DomainException.notFound("PAIRING_CODE_NOT_FOUND"));

        Long requesterId = pending.getRequesterId();
        if (requesterId.equals(acceptorId)) {
            throw DomainException.invalid("SELF_PAIRING");
        }

        // 兩邊都鎖：requester 同時在別處 accept / request 時也要排隊
        User acceptor;
        User requester;
        if (acceptorId < requesterId) {
            acceptor = lockUser(acceptorId);
            requester = lockRequester(requesterId);
        } else {
            requester = lockRequester(requesterId);
            acceptor = lockUser(acceptorId);
        }

        if (repo.countAccepted(acceptorId) >= acceptor.getMaxPairings()) {
            throw DomainException.conflict("QUOTA_EXCEEDED");
        }
        if (repo.countAccepted(requesterId) >= requester.getMaxPairings()) {
            throw DomainException.conflict("PARTNER_QUOTA_EXCEEDED");
        }
        if (repo.countAcceptedBetween(acceptorId, requesterId) > 0) {
            throw DomainException.conflict("ALREADY_PAIRED");
        }

        // 條件式 update：輸家（code 已被用掉）拿到 0
        int n = repo.acceptByCode(code, acceptorId, clock.instant());
        if (n == 0) throw DomainException.notFound("PAIRING_CODE_NOT_FOUND");

        Pairing accepted = repo.findById(pending.getId())
                .orElseThrow(() -> DomainException.notFound("PAIRING_NOT_FOUND"));
        log.info("pairing_accepted pairingId={} requesterId={} partnerId={}",
                accepted.getId(), accepted.getRequesterId(), acceptorId);
        return PairingDto.from(accepted, acceptorId);
    }

    @Transactional
    public PairingDto reject(Long actorId, Long pairingId) {
        Pairing p = repo.findActiveById(pairingId)
                .orElseThrow(() -> DomainException.notFound("PAIRING_NOT_FOUND"));
        if (!p.isParticipant(actorId)) throw DomainException.forbidden("PAIRING_FORBIDDEN");
        if (p.getStatus() != PairingStatus.PENDING) throw DomainException.conflict("ALREADY_PROCESSED");

        int n = repo.reject(pairingId);
        if (n == 0) throw DomainException.conflict("ALREADY_PROCESSED");

        log.info("pairing_rejected pairingId={} actorId={}", pairingId, actorId);
        return repo.findById(pairingId).map(x -> PairingDto.from(x, actorId))
                .orElseThrow(() -> DomainException.notFound("PAIRING_NOT_FOUND"));
    }

    @Transactional
    public void softDelete(Long actorId, Long pairingId) {
        Pairing p = repo.findActiveById(pairingId)
                .orElseThrow(() -> DomainException.notFound("PAIRING_NOT_FOUND_OR_ALREADY_DELETED"));
        if (!p.isParticipant(actorId)) throw DomainException.forbidden("PAIRING_FORBIDDEN");

        int n = repo.softDelete(pairingId, clock.instant());
        if (n == 0) throw DomainException.notFound("PAIRING_NOT_FOUND_OR_ALREADY_DELETED");
        log.info("pairing_deleted pairingId={} actorId={}", pairingId, actorId);
    }

    @Transactional
    public PairingDto restore(Long actorId, Long pairingId) {
        Pairing p = repo.findByIdForUpdate(pairingId)
                .orElseThrow(() -> DomainException.notFound("PAIRING_NOT_FOUND"));
        if (!p.isParticipant(actorId)) throw DomainException.forbidden("PAIRING_FORBIDDEN");
        if (p.getDeletedAt() == null) throw DomainException.notFound("PAIRING_NOT_FOUND_OR_NOT_DELETED");

        // 還原等於重新佔一個名額：跟 request / accept 一樣先鎖人再數
        List<User> participants = lockParticipants(p);
        if (p.getStatus() == PairingStatus.ACCEPTED) {
            for (User u : participants) {
                if (repo.countAccepted(u.getId()) >= u.getMaxPairings()) {
                    throw DomainException.conflict("QUOTA_EXCEEDED");
                }
            }
            if (repo.countAcceptedBetween(p.getRequesterId(), p.getPartnerId()) > 0) {
                throw DomainException.conflict("ALREADY_PAIRED");
            }
        } else if (p.getStatus() == PairingStatus.PENDING && p.getPartnerCode() != null) {
            User requester = participants.get(0);
            if (repo.countAccepted(requester.getId()) >= requester.getMaxPairings()) {
                throw DomainException.conflict("QUOTA_EXCEEDED");
            }
            if (repo.countOpenRequests(requester.getId()) > 0) {
                throw DomainException.conflict("DUPLICATE_PENDING_REQUEST");
            }
        }

        int n = repo.restore(pairingId);
        if (n == 0) throw DomainException.notFound("PAIRING_NOT_FOUND_OR_NOT_DELETED");
        log.info("pairing_restored pairingId={} actorId={}", pairingId, actorId);
        return repo.findById(pairingId).map(x -> PairingDto.from(x, actorId))
                .orElseThrow(() -> DomainException.notFound("PAIRING_NOT_FOUND"));
    }

    /**
     * 帳號 tombstone 用：該帳號所有未刪除的 pairing 一次 soft delete
     * 呼叫端自行決定失敗要不要擋（帳號刪除是 best-effort）
     */
    @Transactional
    public int cascadeSoftDeleteForAccount(Long userId) {
        int n = repo.softDeleteAllForUser(userId, clock.instant());
        log.info("pairing_cascade_deleted userId={} count={}", userId, n);
        return n;
    }

    // ===== queries =====

    @Transactional(readOnly = true)
    public List<PairingDto> listForUser(Long userId, boolean includeDeleted) {
        List<Pairing> rows = includeDeleted
                ? repo.findAllForUserIncludingDeleted(userId)
                : repo.findAllForUser(userId);
        return rows.stream().map(p -> PairingDto.from(p, userId)).toList();
    }

    @Transactional(readOnly = true)
    public List<PairingDto> listByStatus(Long userId, PairingStatus status) {
        return repo.findForUserByStatus(userId, status).stream().map(p -> PairingDto.from(p, userId)).toList();
    }

    @Transactional(readOnly = true)
    public PairingDto get(Long actorId, Long pairingId) {
        Pairing p = repo.findActiveById(pairingId)
                .orElseThrow(() -> DomainException.notFound("PAIRING_NOT_FOUND"));
        if (!p.isParticipant(actorId)) throw DomainException.forbidden("PAIRING_FORBIDDEN");
        return PairingDto.from(p, actorId);
    }

    @Transactional(readOnly = true)
    public PairingDto getIncludingDeleted(Long actorId, Long pairingId) {
        Pairing p = repo.findById(pairingId)
                .orElseThrow(() -> DomainException.notFound("PAIRING_NOT_FOUND"));
        if (!p.isParticipant(actorId)) throw DomainException.forbidden("PAIRING_FORBIDDEN");
        return PairingDto.from(p, actorId);
    }

    @Transactional(readOnly = true)
    public PairingStats stats(Long userId) {
        User user = userRepo.findActiveById(userId)
                .orElseThrow(() -> DomainException.notFound("USER_NOT_FOUND"));
        List<Pairing> rows = repo.findAllForUser(userId);

        long accepted = rows.stream().filter(p -> p.getStatus() == PairingStatus.ACCEPTED).count();
        long pending = rows.stream().filter(p -> p.getStatus() == PairingStatus.PENDING).count();
        long rejected = rows.stream().filter(p -> p.getStatus() == PairingStatus.REJECTED).count();
        long slots = Math.max(0, user.getMaxPairings() - accepted);

        return new PairingStats(rows.size(), accepted, pending, rejected, user.getMaxPairings(), slots, slots > 0);
    }

    /** program / trigger 用：只回 accepted 且未刪除的 pairing */
    @Transactional(readOnly = true)
    public Optional<Pairing> findActiveAccepted(Long pairingId) {
        if (pairingId == null) return Optional.empty();
        return repo.findActiveById(pairingId).filter(Pairing::isActiveAccepted);
    }

    private User lockUser(Long userId) {
        return userRepo.findActiveByIdForUpdate(userId)
                .orElseThrow(() -> DomainException.notFound("USER_NOT_FOUND"));
    }

    /** 對方帳號已 tombstone：code 視同不存在 */
    private User lockRequester(Long requesterId) {
        return userRepo.findActiveByIdForUpdate(requesterId)
                .orElseThrow(() -> DomainException.notFound("PAIRING_CODE_NOT_FOUND"));
    }

    /** requester 排第一個；鎖的順序一律小 id 先 */
    private List<User> lockParticipants(Pairing p) {
        Long requesterId = p.getRequesterId();
        Long partnerId = p.getPartnerId();
        if (partnerId == null) return List.of(lockUser(requesterId));
        if (requesterId < partnerId) {
            User requester = lockUser(requesterId);
            return List.of(requester, lockUser(partnerId));
        }
        User partner = lockUser(partnerId);
        return List.of(lockUser(requesterId), partner);
    }

    private static String normalizeCode(String raw) {
        return (raw == null) ? null : raw.trim().toUpperCase(Locale.ROOT);
    }
}
