package com.clouddeploy.controller;

import com.clouddeploy.model.dto.AdminUserUpdateRequest;
import com.clouddeploy.model.dto.PlatformStatsResponse;
import com.clouddeploy.model.dto.UserResponse;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.service.AdminService;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Admin-only endpoints.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminController {

    private final AdminService adminService;

    @GetMapping("/users")
    public Flux<UserResponse> listUsers(@AuthenticationPrincipal User admin) {
        return adminService.listUsers(admin);
    }

    @PatchMapping("/users/{userId}")
    public Mono<UserResponse> updateUser(
            @AuthenticationPrincipal User admin,
            @PathVariable UUID userId,
            @RequestBody AdminUserUpdateRequest request) {
        return adminService.updateUser(admin, userId, request);
    }

    @GetMapping("/stats")
    public Mono<PlatformStatsResponse> getStats(@AuthenticationPrincipal User admin) {
        return adminService.getStats(admin);
    }
}
