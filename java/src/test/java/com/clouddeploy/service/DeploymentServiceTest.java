package com.clouddeploy.service;

import com.clouddeploy.exception.ResourceNotFoundException;
import com.clouddeploy.model.dto.DeploymentCreateRequest;
import com.clouddeploy.model.dto.DeploymentResponse;
import com.clouddeploy.model.entity.App;
import com.clouddeploy.model.entity.Deployment;
import com.clouddeploy.model.entity.LogEntry;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.model.enums.AppStatus;
import com.clouddeploy.model.enums.DeploymentStatus;
import com.clouddeploy.model.enums.UserRole;
import com.clouddeploy.pipeline.DeploymentLifecycle;
import com.clouddeploy.pipeline.DeploymentScheduler;
import com.clouddeploy.repository.AppRepository;
import com.clouddeploy.repository.DeploymentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for DeploymentService.
 */
@ExtendWith(MockitoExtension.class)
class DeploymentServiceTest {

    @Mock
    private DeploymentRepository deploymentRepository;

    @Mock
    private AppRepository appRepository;

    @Mock
    private DeploymentScheduler deploymentScheduler;

    @Mock
    private DeploymentLifecycle deploymentLifecycle;

    @Mock
    private LogService logService;

    private DeploymentService deploymentService;
    private User user;
    private App app;
    private UUID deploymentId;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);
        deploymentService = new DeploymentService(deploymentRepository, appRepository, deploymentScheduler,
                deploymentLifecycle, logService, clock);

        user = User.builder()
                .id(UUID.randomUUID())
                .username("alice")
                .email("alice@example.com")
                .role(UserRole.USER)
                .active(true)
                .build();

        app = App.builder()
                .id(UUID.randomUUID())
                .userId(user.getId())
                .name("web")
                .status(AppStatus.RUNNING)
                .build();

        deploymentId = UUID.randomUUID();
    }

    @Test
    void createDeployment_StoresPendingAndSchedulesRun() {
        stubCreation();
        when(deploymentScheduler.scheduleDeploymentRun(deploymentId, app.getId())).thenReturn(true);

        DeploymentResponse response = deploymentService.createDeployment(user, request()).block();

        assertThat(response).isNotNull();
        assertThat(response.getId()).isEqualTo(deploymentId.toString());
        assertThat(response.getStatus()).isEqualTo(DeploymentStatus.PENDING);
        assertThat(response.getLogs()).containsExactly(DeploymentLifecycle.INITIAL_LOG_LINE);
        assertThat(response.getCommitSha()).isEqualTo("abc123");
        assertThat(response.getCompletedAt()).isNull();
        verify(deploymentLifecycle, never()).abandon(any(), anyString());
    }

    @Test
    void createDeployment_ActivityLogFailureStillSchedulesRun() {
        stubCreation(Mono.error(new IllegalStateException("logs table unavailable")));
        when(deploymentScheduler.scheduleDeploymentRun(deploymentId, app.getId())).thenReturn(true);

        StepVerifier.create(deploymentService.createDeployment(user, request()))
                .expectNextMatches(response -> response.getId().equals(deploymentId.toString())
                        && response.getStatus() == DeploymentStatus.PENDING)
                .verifyComplete();

        verify(deploymentScheduler).scheduleDeploymentRun(deploymentId, app.getId());
        verify(deploymentLifecycle, never()).abandon(any(), anyString());
    }

    @Test
    void createDeployment_QueueFullEndsDeploymentAsFailed() {
        stubCreation();
        when(deploymentScheduler.scheduleDeploymentRun(deploymentId, app.getId())).thenReturn(false);
        when(deploymentLifecycle.abandon(argThat(job -> job.deploymentId().equals(deploymentId)),
                eq(DeploymentService.QUEUE_FULL_REASON))).thenReturn(Mono.just(DeploymentStatus.FAILED));

        List<String> logs = new ArrayList<>(List.of(DeploymentLifecycle.INITIAL_LOG_LINE,
                "Error: " + DeploymentService.QUEUE_FULL_REASON));
        Deployment failed = Deployment.builder()
                .id(deploymentId)
                .appId(app.getId())
                .userId(user.getId())
                .status(DeploymentStatus.FAILED)
                .logs(logs)
                .createdAt(LocalDateTime.of(2024, 3, 1, 10, 0))
                .completedAt(LocalDateTime.of(2024, 3, 1, 10, 0))
                .build();
        when(deploymentRepository.findById(deploymentId)).thenReturn(Mono.just(failed));

        StepVerifier.create(deploymentService.createDeployment(user, request()))
                .expectNextMatches(response -> response.getStatus() == DeploymentStatus.FAILED
                        && response.getCompletedAt() != null
                        && response.getLogs().get(1).equals("Error: deployment queue is full"))
                .verifyComplete();
    }

    @Test
    void createDeployment_ForeignAppIsNotFound() {
        when(appRepository.findByIdAndUserId(app.getId(), user.getId())).thenReturn(Mono.empty());

        StepVerifier.create(deploymentService.createDeployment(user, request()))
                .expectError(ResourceNotFoundException.class)
                .verify();

        verify(deploymentRepository, never()).save(any(Deployment.class));
        verify(deploymentScheduler, never()).scheduleDeploymentRun(any(), any());
    }

    @Test
    void listDeployments_FiltersByAppWhenGiven() {
        Deployment deployment = Deployment.builder()
                .id(deploymentId)
                .appId(app.getId())
                .userId(user.getId())
                .status(DeploymentStatus.RUNNING)
                .build();
        when(deploymentRepository.findRecentByUserIdAndAppId(user.getId(), app.getId(), DeploymentService.LIST_LIMIT))
                .thenReturn(Flux.just(deployment));

        StepVerifier.create(deploymentService.listDeployments(user, app.getId()))
                .expectNextMatches(response -> response.getId().equals(deploymentId.toString()))
                .verifyComplete();

        verify(deploymentRepository, never()).findRecentByUserId(any(), anyInt());
    }

    @Test
    void getDeployment_ForeignDeploymentIsNotFound() {
        when(deploymentRepository.findByIdAndUserId(deploymentId, user.getId())).thenReturn(Mono.empty());

        StepVerifier.create(deploymentService.getDeployment(user, deploymentId))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    private void stubCreation() {
        stubCreation(Mono.just(new LogEntry()));
    }

    private void stubCreation(Mono<LogEntry> eventResult) {
        when(appRepository.findByIdAndUserId(app.getId(), user.getId())).thenReturn(Mono.just(app));
        when(deploymentRepository.save(any(Deployment.class))).thenAnswer(invocation -> {
            Deployment deployment = invocation.getArgument(0);
            deployment.setId(deploymentId);
            return Mono.just(deployment);
        });
        when(logService.recordDeploymentEvent(eq(user.getId()), eq(app.getId()), eq(deploymentId), anyString()))
                .thenReturn(eventResult);
    }

    private DeploymentCreateRequest request() {
        return DeploymentCreateRequest.builder()
                .appId(app.getId())
                .commitSha("abc123")
                .build();
    }
}
