package com.clouddeploy.controller;

import com.clouddeploy.model.dto.MessageResponse;
import com.clouddeploy.model.dto.UserResponse;
import com.clouddeploy.model.dto.UserUpdateRequest;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Controller for the caller's own account.
 */
@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @PatchMapping("/me")
    public Mono<UserResponse> updateProfile(
            @AuthenticationPrincipal User user,
            @Valid @RequestBody UserUpdateRequest request) {
        return userService.updateProfile(user, request);
    }

    @DeleteMapping("/me")
    public Mono<MessageResponse> deleteAccount(@AuthenticationPrincipal User user) {
        return userService.deleteAccount(user)
                .thenReturn(MessageResponse.of("Account deleted successfully"));
    }
}
