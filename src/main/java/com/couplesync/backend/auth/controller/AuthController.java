package com.couplesync.backend.auth.controller;

import com.couplesync.backend.auth.dto.AuthResponse;
import com.couplesync.backend.auth.dto.LoginRequest;
import com.couplesync.backend.auth.dto.RefreshRequest;
import com.couplesync.backend.auth.service.PasswordAuthService;
import com.couplesync.backend.auth.service.TokenService;
import com.couplesync.backend.common.web.ClientIp;
import com.couplesync.backend.users.user.dto.RegisterRequest;
import com.couplesync.backend.users.user.dto.UserProfileDto;
import com.couplesync.backend.users.user.entity.User;
import com.couplesync.backend.users.user.service.UserService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private final UserService userService;
    private final PasswordAuthService passwordAuthService;
    private final TokenService tokenService;
    private final Clock clock;

    @PostMapping("/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest req) {
        User u = userService.register(req);
        TokenService.AuthTokens t = tokenService.issueTokens(u);
        return ResponseEntity.status(HttpStatus.CREATED).body(AuthResponse.of(t, UserProfileDto.from(u), now()));
    }

    @PostMapping("/login")
    public AuthResponse login(@Valid @RequestBody LoginRequest req, HttpServletRequest http) {
        PasswordAuthService.LoginResult r = passwordAuthService.login(req.email(), req.password(), ClientIp.of(http));
        return AuthResponse.of(r.tokens(), UserProfileDto.from(r.user()), now());
    }

    @PostMapping("/refresh")
    public AuthResponse refresh(@Valid @RequestBody RefreshRequest req) {
        return AuthResponse.of(tokenService.refresh(req.refreshToken()), null, now());
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@Valid @RequestBody RefreshRequest req) {
        tokenService.logout(req.refreshToken());
        return ResponseEntity.noContent().build();
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
