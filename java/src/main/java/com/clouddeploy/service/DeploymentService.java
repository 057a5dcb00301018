package com.clouddeploy.service;

import com.clouddeploy.exception.ResourceNotFoundException;
import com.clouddeploy.model.dto.DeploymentCreateRequest;
import com.clouddeploy.model.dto.DeploymentResponse;
import com.clouddeploy.model.entity.Deployment;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.model.enums.DeploymentStatus;
import com.clouddeploy.pipeline.DeploymentJob;
import com.clouddeploy.pipeline.DeploymentLifecycle;
import com.clouddeploy.pipeline.DeploymentScheduler;
import com.clouddeploy.repository.AppRepository;
import com.clouddeploy.repository.DeploymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Service for creating and reading deployments.
 *
 * Creation stores a pending record and hands it to the scheduler; the
 * lifecycle takes it from there.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeploymentService {

    public static final int LIST_LIMIT = 50;

    static final String QUEUE_FULL_REASON = "deployment queue is full";

    private final DeploymentRepository deploymentRepository;
    private final AppRepository appRepository;
    private final DeploymentScheduler deploymentScheduler;
    private final DeploymentLifecycle deploymentLifecycle;
    private final LogService logService;
    private final Clock clock;

    /**
     * Create a pending deployment for one of the caller's apps and schedule its run.
     *
     * @param user    Caller
     * @param request Target app and optional source revision
     * @return the deployment as stored before the run starts
     */
    public Mono<DeploymentResponse> createDeployment(User user, DeploymentCreateRequest request) {
        return appRepository.findByIdAndUserId(request.getAppId(), user.getId())
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("App")))
                .flatMap(app -> {
                    List<String> logs = new ArrayList<>();
                    logs.add(DeploymentLifecycle.INITIAL_LOG_LINE);

                    Deployment deployment = Deployment.builder()
                            .appId(app.getId())
                            .userId(user.getId())
                            .status(DeploymentStatus.PENDING)
                            .commitSha(request.getCommitSha())
                            .dockerImage(request.getDockerImage())
                            .logs(logs)
                            .createdAt(LocalDateTime.now(clock))
                            .build();

                    return deploymentRepository.save(deployment)
                            .flatMap(saved -> logService.recordDeploymentEvent(user.getId(), app.getId(), saved.getId(),
                                            "Deployment created for app '" + app.getName() + "'")
                                    .onErrorResume(error -> {
                                        log.warn("Could not record creation of deployment {}", saved.getId(), error);
                                        return Mono.empty();
                                    })
                                    .thenReturn(saved))
                            .doOnNext(saved -> log.info("Deployment created: {} for app {}", saved.getId(), app.getName()));
                })
                .flatMap(this::schedule)
                .map(DeploymentResponse::from);
    }

    /**
     * List the caller's deployments, newest first, optionally for one app.
     */
    public Flux<DeploymentResponse> listDeployments(User user, UUID appId) {
        Flux<Deployment> deployments = appId == null
                ? deploymentRepository.findRecentByUserId(user.getId(), LIST_LIMIT)
                : deploymentRepository.findRecentByUserIdAndAppId(user.getId(), appId, LIST_LIMIT);
        return deployments.map(DeploymentResponse::from);
    }

    public Mono<DeploymentResponse> getDeployment(User user, UUID deploymentId) {
        return deploymentRepository.findByIdAndUserId(deploymentId, user.getId())
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Deployment")))
                .map(DeploymentResponse::from);
    }

    private Mono<Deployment> schedule(Deployment deployment) {
        if (deploymentScheduler.scheduleDeploymentRun(deployment.getId(), deployment.getAppId())) {
            return Mono.just(deployment);
        }
        DeploymentJob job = new DeploymentJob(deployment.getId(), deployment.getAppId(), clock.instant());
        return deploymentLifecycle.abandon(job, QUEUE_FULL_REASON)
                .then(deploymentRepository.findById(deployment.getId()))
                .defaultIfEmpty(deployment);
    }
}
