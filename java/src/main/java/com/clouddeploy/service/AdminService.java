package com.clouddeploy.service;

import com.clouddeploy.exception.ResourceNotFoundException;
import com.clouddeploy.model.dto.AdminUserUpdateRequest;
import com.clouddeploy.model.dto.PlatformStatsResponse;
import com.clouddeploy.model.dto.UserResponse;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.pipeline.DeploymentQueue;
import com.clouddeploy.repository.AppRepository;
import com.clouddeploy.repository.DeploymentRepository;
import com.clouddeploy.repository.FunctionRepository;
import com.clouddeploy.repository.UserRepository;
import com.clouddeploy.security.CredentialService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Admin-only user management and platform statistics. Every operation
 * checks the caller's role first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminService {

    private final CredentialService credentialService;
    private final UserRepository userRepository;
    private final AppRepository appRepository;
    private final DeploymentRepository deploymentRepository;
    private final FunctionRepository functionRepository;
    private final DeploymentQueue deploymentQueue;
    private final Clock clock;

    public Flux<UserResponse> listUsers(User admin) {
        return Mono.fromCallable(() -> credentialService.authorizeAdmin(admin))
                .flatMapMany(ok -> userRepository.findAll())
                .map(UserResponse::from);
    }

    /**
     * Activate, deactivate or change the role of any user.
     */
    public Mono<UserResponse> updateUser(User admin, UUID userId, AdminUserUpdateRequest request) {
        return Mono.fromCallable(() -> credentialService.authorizeAdmin(admin))
                .flatMap(ok -> userRepository.findById(userId))
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("User")))
                .flatMap(user -> {
                    if (request.getActive() != null) {
                        user.setActive(request.getActive());
                    }
                    if (request.getRole() != null) {
                        user.setRole(request.getRole());
                    }
                    user.setUpdatedAt(LocalDateTime.now(clock));
                    return userRepository.save(user);
                })
                .doOnNext(user -> log.info("User {} updated by admin {}: active={}, role={}",
                        user.getId(), admin.getId(), user.isActive(), user.getRole()))
                .map(UserResponse::from);
    }

    public Mono<PlatformStatsResponse> getStats(User admin) {
        return Mono.fromCallable(() -> credentialService.authorizeAdmin(admin))
                .flatMap(ok -> Mono.zip(
                        userRepository.count(),
                        appRepository.count(),
                        deploymentRepository.count(),
                        functionRepository.count()))
                .map(totals -> PlatformStatsResponse.builder()
                        .totalUsers(totals.getT1())
                        .totalApps(totals.getT2())
                        .totalDeployments(totals.getT3())
                        .totalFunctions(totals.getT4())
                        .queuedDeployments(deploymentQueue.getDepth())
                        .acceptedDeployments(deploymentQueue.getAcceptedCount())
                        .rejectedDeployments(deploymentQueue.getRejectedCount())
                        .completedDeployments(deploymentQueue.getCompletedCount())
                        .timestamp(LocalDateTime.now(clock))
                        .build());
    }
}
