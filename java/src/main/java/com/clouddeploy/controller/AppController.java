package com.clouddeploy.controller;

import com.clouddeploy.model.dto.AppCreateRequest;
import com.clouddeploy.model.dto.AppResponse;
import com.clouddeploy.model.dto.AppUpdateRequest;
import com.clouddeploy.model.dto.MessageResponse;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.service.AppService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Controller for application management.
 */
@RestController
@RequestMapping("/api/v1/apps")
@RequiredArgsConstructor
public class AppController {

    private final AppService appService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<AppResponse> createApp(
            @AuthenticationPrincipal User user,
            @Valid @RequestBody AppCreateRequest request) {
        return appService.createApp(user, request);
    }

    @GetMapping
    public Flux<AppResponse> listApps(@AuthenticationPrincipal User user) {
        return appService.listApps(user);
    }

    @GetMapping("/{appId}")
    public Mono<AppResponse> getApp(@AuthenticationPrincipal User user, @PathVariable UUID appId) {
        return appService.getApp(user, appId);
    }

    @PatchMapping("/{appId}")
    public Mono<AppResponse> updateApp(
            @AuthenticationPrincipal User user,
            @PathVariable UUID appId,
            @Valid @RequestBody AppUpdateRequest request) {
        return appService.updateApp(user, appId, request);
    }

    @DeleteMapping("/{appId}")
    public Mono<MessageResponse> deleteApp(@AuthenticationPrincipal User user, @PathVariable UUID appId) {
        return appService.deleteApp(user, appId)
                .thenReturn(MessageResponse.of("App deleted successfully"));
    }

    @PostMapping("/{appId}/start")
    public Mono<MessageResponse> startApp(@AuthenticationPrincipal User user, @PathVariable UUID appId) {
        return appService.startApp(user, appId);
    }

    @PostMapping("/{appId}/stop")
    public Mono<MessageResponse> stopApp(@AuthenticationPrincipal User user, @PathVariable UUID appId) {
        return appService.stopApp(user, appId);
    }

    @PostMapping("/{appId}/restart")
    public Mono<MessageResponse> restartApp(@AuthenticationPrincipal User user, @PathVariable UUID appId) {
        return appService.restartApp(user, appId);
    }
}
