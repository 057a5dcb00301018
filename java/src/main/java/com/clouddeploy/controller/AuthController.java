package com.clouddeploy.controller;

import com.clouddeploy.model.dto.ApiKeyCreateRequest;
import com.clouddeploy.model.dto.ApiKeyResponse;
import com.clouddeploy.model.dto.LoginRequest;
import com.clouddeploy.model.dto.MessageResponse;
import com.clouddeploy.model.dto.RefreshRequest;
import com.clouddeploy.model.dto.SignupRequest;
import com.clouddeploy.model.dto.TokenResponse;
import com.clouddeploy.model.dto.UserResponse;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.service.ApiKeyService;
import com.clouddeploy.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Controller for signup, login, token refresh and API keys.
 */
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;
    private final ApiKeyService apiKeyService;

    @PostMapping("/signup")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<UserResponse> signup(@Valid @RequestBody SignupRequest request) {
        return authService.signup(request);
    }

    @PostMapping("/login")
    public Mono<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        return authService.login(request);
    }

    @PostMapping("/refresh")
    public Mono<TokenResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return authService.refresh(request);
    }

    @GetMapping("/me")
    public Mono<UserResponse> me(@AuthenticationPrincipal User user) {
        return Mono.just(UserResponse.from(user));
    }

    @PostMapping("/api-keys")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ApiKeyResponse> createApiKey(
            @AuthenticationPrincipal User user,
            @Valid @RequestBody ApiKeyCreateRequest request) {
        return apiKeyService.createApiKey(user, request);
    }

    @GetMapping("/api-keys")
    public Flux<ApiKeyResponse> listApiKeys(@AuthenticationPrincipal User user) {
        return apiKeyService.listApiKeys(user);
    }

    @DeleteMapping("/api-keys/{keyId}")
    public Mono<MessageResponse> deleteApiKey(
            @AuthenticationPrincipal User user,
            @PathVariable UUID keyId) {
        return apiKeyService.deleteApiKey(user, keyId)
                .thenReturn(MessageResponse.of("API key deleted successfully"));
    }
}
