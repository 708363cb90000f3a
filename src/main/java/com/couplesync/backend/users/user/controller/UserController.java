package com.couplesync.backend.users.user.controller;

import com.couplesync.backend.auth.security.AuthContext;
import com.couplesync.backend.users.user.dto.AccountDeletionResult;
import com.couplesync.backend.users.user.dto.UpdateProfileRequest;
import com.couplesync.backend.users.user.dto.UserProfileDto;
import com.couplesync.backend.users.user.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/users")
public class UserController {

    private final UserService userService;
    private final AuthContext auth;

    @GetMapping("/me")
    public UserProfileDto me() {
        return userService.getProfile(auth.requireUserId());
    }

    @PatchMapping("/me")
    public UserProfileDto update(@Valid @RequestBody UpdateProfileRequest req) {
        return userService.updateProfile(auth.requireUserId(), req);
    }

    @DeleteMapping("/me")
    public AccountDeletionResult delete() {
        return userService.softDelete(auth.requireUserId());
    }

    /** 刪除後 access token 還沒過期前可以反悔 */
    @PostMapping("/me/restore")
    public UserProfileDto restore() {
        return userService.restore(auth.requireUserId());
    }
}
