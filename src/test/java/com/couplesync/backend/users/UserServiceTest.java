package com.couplesync.backend.users;

import com.couplesync.backend.auth.service.TokenService;
import com.couplesync.backend.common.error.DomainException;
import com.couplesync.backend.common.error.ErrorKind;
import com.couplesync.backend.pairing.service.PairingService;
import com.couplesync.backend.users.user.dto.AccountDeletionResult;
import com.couplesync.backend.users.user.dto.RegisterRequest;
import com.couplesync.backend.users.user.dto.UpdateProfileRequest;
import com.couplesync.backend.users.user.dto.UserProfileDto;
import com.couplesync.backend.users.user.entity.User;
import com.couplesync.backend.users.user.repo.UserRepo;
import com.couplesync.backend.users.user.service.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class UserServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private UserRepo userRepo;
    private PasswordEncoder encoder;
    private PairingService pairingService;
    private TokenService tokenService;
    private UserService svc;

    @BeforeEach
    void setUp() {
        userRepo = mock(UserRepo.class);
        encoder = mock(PasswordEncoder.class);
        pairingService = mock(PairingService.class);
        tokenService = mock(TokenService.class);
        svc = new UserService(userRepo, encoder, pairingService, tokenService, Clock.fixed(NOW, ZoneOffset.UTC));

        when(encoder.encode(anyString())).thenAnswer(inv -> "hash:" + inv.getArgument(0));
        when(userRepo.saveAndFlush(any(User.class))).thenAnswer(inv -> {
            User u = inv.getArgument(0);
            u.setId(1L);
            return u;
        });
    }

    @Test
    void register_lowercases_email_and_hashes_password() {
        User u = svc.register(new RegisterRequest("  Amy@Example.COM ", "correct-horse", "Amy", " ", 0));

        assertThat(u.getEmail()).isEqualTo("amy@example.com");
        assertThat(u.getPasswordHash()).isEqualTo("hash:correct-horse");
        assertThat(u.getUserName()).isEqualTo("Amy");
        assertThat(u.getPartnerName()).isNull();
        assertThat(u.getMaxPairings()).isEqualTo(1);
    }

    @Test
    void register_email_is_locale_independent() {
        Locale prev = Locale.getDefault();
        User u;
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            u = svc.register(new RegisterRequest("KIM@MAIL.IO", "correct-horse", null, null, null));
        } finally {
            Locale.setDefault(prev);
        }

        assertThat(u.getEmail()).isEqualTo("kim@mail.io");
        verify(userRepo).existsByEmailIgnoreCase("kim@mail.io");
    }

    @Test
    void register_duplicate_email_is_conflict_including_race_on_unique_index() {
        when(userRepo.existsByEmailIgnoreCase("amy@example.com")).thenReturn(true);
        DomainException ex = catchThrowableOfType(
                () -> svc.register(new RegisterRequest("amy@example.com", "correct-horse", null, null, null)),
                DomainException.class);
        assertThat(ex.code()).isEqualTo("EMAIL_ALREADY_REGISTERED");
        assertThat(ex.kind()).isEqualTo(ErrorKind.CONFLICT);

        when(userRepo.existsByEmailIgnoreCase("bob@example.com")).thenReturn(false);
        doThrow(new DataIntegrityViolationException("ux_users_email")).when(userRepo).saveAndFlush(any(User.class));
        assertThatThrownBy(() -> svc.register(new RegisterRequest("bob@example.com", "correct-horse", null, null, null)))
                .isInstanceOf(DomainException.class)
                .hasMessage("EMAIL_ALREADY_REGISTERED");
    }

    @Test
    void updateProfile_only_touches_present_fields() {
        User u = new User();
        u.setId(1L);
        u.setEmail("amy@example.com");
        u.setUserName("Amy");
        u.setPartnerName("Ben");
        u.setChildren(2);
        when(userRepo.findActiveById(1L)).thenReturn(Optional.of(u));
        when(userRepo.save(u)).thenReturn(u);

        UserProfileDto dto = svc.updateProfile(1L, new UpdateProfileRequest(null, "Benjamin", null));

        assertThat(dto.userName()).isEqualTo("Amy");
        assertThat(dto.partnerName()).isEqualTo("Benjamin");
        assertThat(dto.children()).isEqualTo(2);

        assertThatThrownBy(() -> svc.updateProfile(1L, new UpdateProfileRequest(null, null, null)))
                .hasMessage("NO_FIELDS_TO_UPDATE");
    }

    @Test
    void softDelete_tombstones_then_cascades_pairings_and_sessions() {
        when(userRepo.softDelete(1L, NOW)).thenReturn(1);
        when(pairingService.cascadeSoftDeleteForAccount(1L)).thenReturn(2);
        when(tokenService.cascadeRevokeForAccount(1L)).thenReturn(1);

        AccountDeletionResult r = svc.softDelete(1L);

        assertThat(r.pairingsDeleted()).isEqualTo(2);
        assertThat(r.sessionsRevoked()).isEqualTo(1);
        assertThat(r.fullyCascaded()).isTrue();

        InOrder order = inOrder(userRepo, pairingService, tokenService);
        order.verify(userRepo).softDelete(1L, NOW);
        order.verify(pairingService).cascadeSoftDeleteForAccount(1L);
        order.verify(tokenService).cascadeRevokeForAccount(1L);
    }

    @Test
    void softDelete_cascade_failure_is_reported_but_does_not_fail_tombstone() {
        when(userRepo.softDelete(1L, NOW)).thenReturn(1);
        when(pairingService.cascadeSoftDeleteForAccount(1L)).thenThrow(new QueryTimeoutException("lock wait"));
        when(tokenService.cascadeRevokeForAccount(1L)).thenReturn(3);

        AccountDeletionResult r = svc.softDelete(1L);

        assertThat(r.pairingsDeleted()).isNull();
        assertThat(r.pairingsError()).isEqualTo("STORE_ERROR");
        // 第二個 cascade 照跑
        assertThat(r.sessionsRevoked()).isEqualTo(3);
        assertThat(r.fullyCascaded()).isFalse();
        verify(userRepo, never()).restore(anyLong());
    }

    @Test
    void softDelete_twice_and_restore_active_are_not_found() {
        when(userRepo.softDelete(1L, NOW)).thenReturn(0);
        when(userRepo.restore(1L)).thenReturn(0);

        assertThatThrownBy(() -> svc.softDelete(1L)).hasMessage("USER_NOT_FOUND_OR_ALREADY_DELETED");
        assertThatThrownBy(() -> svc.restore(1L)).hasMessage("USER_NOT_FOUND_OR_NOT_DELETED");
        verifyNoInteractions(pairingService, tokenService);
    }
}
