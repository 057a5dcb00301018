package com.clouddeploy.pipeline;

import com.clouddeploy.config.PlatformProperties;
import com.clouddeploy.exception.PipelineFaultException;
import com.clouddeploy.model.enums.AppStatus;
import com.clouddeploy.model.enums.DeploymentStatus;
import com.clouddeploy.repository.AppRepository;
import com.clouddeploy.repository.DeploymentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Drives one deployment from pending to running or failed.
 *
 * Terminal updates set status and completion time in one statement, and the
 * owning app's status is written only after that statement applied. Faults
 * end the run as failed and are never propagated.
 */
@Slf4j
@Component
public class DeploymentLifecycle {

    public static final String INITIAL_LOG_LINE = "Deployment initiated";

    public static final List<String> BUILD_STAGES = List.of(
            "Pulling source code...",
            "Building application...",
            "Running tests...",
            "Deploying to server...",
            "Deployment completed successfully"
    );

    static final int APP_STATUS_RETRIES = 2;

    private final DeploymentRepository deploymentRepository;
    private final AppRepository appRepository;
    private final Clock clock;
    private final Duration stepDelay;

    public DeploymentLifecycle(DeploymentRepository deploymentRepository,
                               AppRepository appRepository,
                               Clock clock,
                               PlatformProperties properties) {
        this.deploymentRepository = deploymentRepository;
        this.appRepository = appRepository;
        this.clock = clock;
        this.stepDelay = properties.getDeployment().getStepDelay();
    }

    /**
     * Run the lifecycle of a pending deployment.
     *
     * @param job Queued deployment
     * @return the terminal status reached, or empty when the deployment was
     * not pending or its outcome could not be recorded
     */
    public Mono<DeploymentStatus> run(DeploymentJob job) {
        UUID deploymentId = job.deploymentId();
        return Mono.defer(() -> deploymentRepository.markDeploying(deploymentId))
                .flatMap(updated -> {
                    if (updated == 0) {
                        log.warn("Deployment {} is not pending, skipping run", deploymentId);
                        return Mono.<DeploymentStatus>empty();
                    }
                    log.info("Deployment {} started for app {}", deploymentId, job.appId());
                    return executeStages(deploymentId).then(Mono.defer(() -> complete(job)));
                })
                .onErrorResume(error -> {
                    log.error("Deployment {} failed", deploymentId, error);
                    return recordFailure(job, describe(error));
                });
    }

    /**
     * End a deployment that will never run, e.g. when the queue rejected it.
     */
    public Mono<DeploymentStatus> abandon(DeploymentJob job, String reason) {
        log.warn("Abandoning deployment {}: {}", job.deploymentId(), reason);
        return recordFailure(job, reason);
    }

    private Mono<Void> executeStages(UUID deploymentId) {
        return Flux.fromIterable(BUILD_STAGES)
                .concatMap(stage -> pause()
                        .then(Mono.defer(() -> deploymentRepository.appendLog(deploymentId, stage)))
                        .flatMap(updated -> requireApplied(updated, "Deployment " + deploymentId + " completed while building")))
                .then();
    }

    private Mono<DeploymentStatus> complete(DeploymentJob job) {
        return Mono.defer(() -> deploymentRepository.markRunning(job.deploymentId(), now()))
                .flatMap(updated -> requireApplied(updated, "Deployment " + job.deploymentId() + " is no longer deploying"))
                .then(mirrorAppStatus(job, DeploymentStatus.RUNNING))
                .doOnSuccess(done -> log.info("Deployment {} completed, app {} running", job.deploymentId(), job.appId()))
                .thenReturn(DeploymentStatus.RUNNING);
    }

    private Mono<DeploymentStatus> recordFailure(DeploymentJob job, String reason) {
        return Mono.defer(() -> deploymentRepository.markFailed(job.deploymentId(), now(), "Error: " + reason))
                .flatMap(updated -> {
                    if (updated == 0) {
                        log.warn("Deployment {} already terminal, failure not recorded", job.deploymentId());
                        return Mono.<DeploymentStatus>empty();
                    }
                    return mirrorAppStatus(job, DeploymentStatus.FAILED)
                            .thenReturn(DeploymentStatus.FAILED);
                })
                .onErrorResume(error -> {
                    log.error("Could not record failure of deployment {}", job.deploymentId(), error);
                    return Mono.empty();
                });
    }

    /**
     * Copy a terminal status onto the owning app once the deployment row holds it.
     * The deployment is already terminal, so a failed update is retried, then logged.
     */
    private Mono<Void> mirrorAppStatus(DeploymentJob job, DeploymentStatus status) {
        return Mono.defer(() -> appRepository.updateStatus(job.appId(), AppStatus.mirror(status).name()))
                .retry(APP_STATUS_RETRIES)
                .onErrorResume(error -> {
                    log.error("Deployment {} is {} but app {} status is stale", job.deploymentId(),
                            status.getValue(), job.appId(), error);
                    return Mono.empty();
                })
                .then();
    }

    private Mono<Void> pause() {
        if (stepDelay.isZero() || stepDelay.isNegative()) {
            return Mono.empty();
        }
        return Mono.delay(stepDelay).then();
    }

    private static Mono<Integer> requireApplied(Integer updated, String message) {
        if (updated == null || updated == 0) {
            return Mono.error(new PipelineFaultException(message));
        }
        return Mono.just(updated);
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
