package com.couplesync.backend.users.user.service;

import com.couplesync.backend.auth.service.TokenService;
import com.couplesync.backend.common.error.DomainException;
import com.couplesync.backend.pairing.service.PairingService;
import com.couplesync.backend.users.user.dto.AccountDeletionResult;
import com.couplesync.backend.users.user.dto.RegisterRequest;
import com.couplesync.backend.users.user.dto.UpdateProfileRequest;
import com.couplesync.backend.users.user.dto.UserProfileDto;
import com.couplesync.backend.users.user.entity.User;
import com.couplesync.backend.users.user.repo.UserRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;

@Slf4j
@RequiredArgsConstructor
@Service
public class UserService {

    private final UserRepo userRepo;
    private final PasswordEncoder passwordEncoder;
    private final PairingService pairingService;
    private final TokenService tokenService;
    private final Clock clock;

    @Transactional
    public User register(RegisterRequest req) {
        String email = req.email().trim().toLowerCase(Locale.ROOT);
        if (userRepo.existsByEmailIgnoreCase(email)) {
            throw DomainException.conflict("EMAIL_ALREADY_REGISTERED");
        }

        User u = new User();
        u.setEmail(email);
        u.setPasswordHash(passwordEncoder.encode(req.password()));
        u.setUserName(blankToNull(req.userName()));
        u.setPartnerName(blankToNull(req.partnerName()));
        u.setChildren(req.children());

        try {
            User saved = userRepo.saveAndFlush(u);
            log.info("user_registered userId={}", saved.getId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            // 同 email 併發註冊：unique index 擋下
            throw DomainException.conflict("EMAIL_ALREADY_REGISTERED");
        }
    }

    @Transactional(readOnly = true)
    public User requireActive(Long userId) {
        return userRepo.findActiveById(userId)
                .orElseThrow(() -> DomainException.notFound("USER_NOT_FOUND"));
    }

    @Transactional(readOnly = true)
    public UserProfileDto getProfile(Long userId) {
        return UserProfileDto.from(requireActive(userId));
    }

    @Transactional
    public UserProfileDto updateProfile(Long userId, UpdateProfileRequest req) {
        if (req == null || req.isEmpty()) throw DomainException.invalid("NO_FIELDS_TO_UPDATE");

        User u = requireActive(userId);
        if (req.userName() != null) u.setUserName(blankToNull(req.userName()));
        if (req.partnerName() != null) u.setPartnerName(blankToNull(req.partnerName()));
        if (req.children() != null) u.setChildren(req.children());

        return UserProfileDto.from(userRepo.save(u));
    }

    /**
     * 帳號 tombstone：
     * 1) users.deleted_at 先落地（自己的 transaction，之後的 cascade 失敗不會回滾它）
     * 2) pairings soft delete（best-effort）
     * 3) refresh sessions 全刪（best-effort）
     */
    public AccountDeletionResult softDelete(Long userId) {
        Instant now = clock.instant();

        int n = userRepo.softDelete(userId, now);
        if (n == 0) throw DomainException.notFound("USER_NOT_FOUND_OR_ALREADY_DELETED");

        Integer pairings = null;
        String pairingsError = null;
        try {
            pairings = pairingService.cascadeSoftDeleteForAccount(userId);
        } catch (RuntimeException e) {
            pairingsError = errorCode(e);
            log.warn("account_delete_cascade_failed userId={} target=pairings code={}", userId, pairingsError, e);
        }

        Integer sessions = null;
        String sessionsError = null;
        try {
            sessions = tokenService.cascadeRevokeForAccount(userId);
        } catch (RuntimeException e) {
            sessionsError = errorCode(e);
            log.warn("account_delete_cascade_failed userId={} target=sessions code={}", userId, sessionsError, e);
        }

        log.info("account_deleted userId={} pairingsDeleted={} sessionsRevoked={}", userId, pairings, sessions);
        return new AccountDeletionResult(userId, pairings, pairingsError, sessions, sessionsError);
    }

    /** 還原帳號本身；pairings 不自動還原（需個別 restore） */
    public UserProfileDto restore(Long userId) {
        int n = userRepo.restore(userId);
        if (n == 0) throw DomainException.notFound("USER_NOT_FOUND_OR_NOT_DELETED");
        log.info("account_restored userId={}", userId);
        return getProfile(userId);
    }

    private static String errorCode(RuntimeException e) {
        if (e instanceof DomainException de) return de.code();
        return "STORE_ERROR";
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
