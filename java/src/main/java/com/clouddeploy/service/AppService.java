package com.clouddeploy.service;

import com.clouddeploy.config.PlatformProperties;
import com.clouddeploy.exception.DuplicateResourceException;
import com.clouddeploy.exception.InvalidRequestException;
import com.clouddeploy.exception.ResourceNotFoundException;
import com.clouddeploy.model.dto.AppCreateRequest;
import com.clouddeploy.model.dto.AppResponse;
import com.clouddeploy.model.dto.AppUpdateRequest;
import com.clouddeploy.model.dto.MessageResponse;
import com.clouddeploy.model.entity.App;
import com.clouddeploy.model.entity.LogEntry;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.model.enums.AppStatus;
import com.clouddeploy.model.enums.DeploymentSource;
import com.clouddeploy.repository.AppRepository;
import com.clouddeploy.repository.DeploymentRepository;
import com.clouddeploy.repository.LogEntryRepository;
import com.clouddeploy.util.JsonColumnMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Service for application management.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppService {

    private final AppRepository appRepository;
    private final DeploymentRepository deploymentRepository;
    private final LogEntryRepository logEntryRepository;
    private final LogService logService;
    private final JsonColumnMapper jsonColumns;
    private final PlatformProperties properties;
    private final Clock clock;

    /**
     * Create an app in pending state and assign its public URL.
     *
     * @param user    Owner
     * @param request App definition
     * @return the created app
     */
    @Transactional
    public Mono<AppResponse> createApp(User user, AppCreateRequest request) {
        String name = request.getName().toLowerCase(Locale.ROOT);
        int maxApps = properties.getMaxAppsPerUser();

        return appRepository.countByUserId(user.getId())
                .flatMap(count -> {
                    if (count >= maxApps) {
                        return Mono.error(new InvalidRequestException("Maximum " + maxApps + " apps per user"));
                    }
                    return appRepository.existsByUserIdAndName(user.getId(), name);
                })
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.error(new DuplicateResourceException("App", name));
                    }
                    validateSourceConfig(request.getSourceType(), request.getSourceConfig());

                    LocalDateTime now = LocalDateTime.now(clock);
                    App app = App.builder()
                            .userId(user.getId())
                            .name(name)
                            .description(request.getDescription())
                            .status(AppStatus.PENDING)
                            .sourceType(request.getSourceType())
                            .sourceConfig(jsonColumns.write(request.getSourceConfig()))
                            .envVars(jsonColumns.write(request.getEnvVars() == null ? Map.of() : request.getEnvVars()))
                            .url("")
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                    return appRepository.save(app);
                })
                // The URL embeds the generated id
                .flatMap(saved -> {
                    saved.setUrl(appUrl(saved));
                    return appRepository.save(saved);
                })
                .flatMap(saved -> logService.recordAppEvent(user.getId(), saved.getId(),
                                LogEntry.TYPE_DEPLOYMENT, "App '" + saved.getName() + "' created")
                        .thenReturn(saved))
                .doOnNext(saved -> log.info("App created: {} by user {}", saved.getName(), user.getId()))
                .map(this::toResponse);
    }

    public Flux<AppResponse> listApps(User user) {
        return appRepository.findByUserId(user.getId())
                .map(this::toResponse);
    }

    public Mono<AppResponse> getApp(User user, UUID appId) {
        return findOwned(user, appId).map(this::toResponse);
    }

    /**
     * Apply a partial update. Null fields are left unchanged.
     */
    @Transactional
    public Mono<AppResponse> updateApp(User user, UUID appId, AppUpdateRequest request) {
        return findOwned(user, appId)
                .flatMap(app -> {
                    if (request.getDescription() != null) {
                        app.setDescription(request.getDescription());
                    }
                    if (request.getEnvVars() != null) {
                        app.setEnvVars(jsonColumns.write(request.getEnvVars()));
                    }
                    if (request.getStatus() != null) {
                        app.setStatus(request.getStatus());
                    }
                    app.setUpdatedAt(LocalDateTime.now(clock));
                    return appRepository.save(app);
                })
                .doOnNext(app -> log.info("App updated: {} by user {}", app.getName(), user.getId()))
                .map(this::toResponse);
    }

    /**
     * Delete an app together with its deployments and log entries.
     */
    @Transactional
    public Mono<Void> deleteApp(User user, UUID appId) {
        return findOwned(user, appId)
                .flatMap(app -> deploymentRepository.deleteByAppId(app.getId())
                        .then(logEntryRepository.deleteByAppId(app.getId()))
                        .then(appRepository.delete(app))
                        .doOnSuccess(done -> log.info("App deleted: {} by user {}", app.getName(), user.getId())));
    }

    public Mono<MessageResponse> startApp(User user, UUID appId) {
        return changeRuntimeState(user, appId, AppStatus.RUNNING, "started");
    }

    public Mono<MessageResponse> stopApp(User user, UUID appId) {
        return changeRuntimeState(user, appId, AppStatus.STOPPED, "stopped");
    }

    public Mono<MessageResponse> restartApp(User user, UUID appId) {
        return changeRuntimeState(user, appId, AppStatus.RUNNING, "restarted");
    }

    Mono<App> findOwned(User user, UUID appId) {
        return appRepository.findByIdAndUserId(appId, user.getId())
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("App")));
    }

    private Mono<MessageResponse> changeRuntimeState(User user, UUID appId, AppStatus status, String action) {
        return findOwned(user, appId)
                .flatMap(app -> {
                    app.setStatus(status);
                    app.setUpdatedAt(LocalDateTime.now(clock));
                    return appRepository.save(app);
                })
                .flatMap(app -> logService.recordAppEvent(user.getId(), app.getId(),
                                LogEntry.TYPE_RUNTIME, "App '" + app.getName() + "' " + action)
                        .thenReturn(app))
                .doOnNext(app -> log.info("App {}: {} by user {}", action, app.getName(), user.getId()))
                .map(app -> MessageResponse.of("App " + action + " successfully"));
    }

    private static void validateSourceConfig(DeploymentSource sourceType, Map<String, Object> sourceConfig) {
        if (sourceType == DeploymentSource.GITHUB && !sourceConfig.containsKey("repo_url")) {
            throw new InvalidRequestException("GitHub repo_url required in source_config");
        }
        if (sourceType == DeploymentSource.DOCKER && !sourceConfig.containsKey("image")) {
            throw new InvalidRequestException("Docker image required in source_config");
        }
    }

    private String appUrl(App app) {
        return String.format("https://%s-%s.%s",
                app.getName(), app.getId().toString().substring(0, 8), properties.getBaseDomain());
    }

    private AppResponse toResponse(App app) {
        return AppResponse.builder()
                .id(app.getId().toString())
                .name(app.getName())
                .description(app.getDescription())
                .userId(app.getUserId().toString())
                .status(app.getStatus())
                .sourceType(app.getSourceType())
                .sourceConfig(jsonColumns.readObjectMap(app.getSourceConfig()))
                .envVars(jsonColumns.readStringMap(app.getEnvVars()))
                .url(app.getUrl())
                .createdAt(app.getCreatedAt())
                .updatedAt(app.getUpdatedAt())
                .build();
    }
}
