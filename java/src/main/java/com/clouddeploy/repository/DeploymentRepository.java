package com.clouddeploy.repository;

import com.clouddeploy.model.entity.Deployment;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Repository for Deployment entities.
 *
 * The lifecycle updates are conditional so that a state is never revisited
 * and nothing is appended once completed_at is set. Each returns the number
 * of rows changed.
 */
@Repository
public interface DeploymentRepository extends ReactiveCrudRepository<Deployment, UUID> {

    Mono<Deployment> findByIdAndUserId(UUID id, UUID userId);

    @Query("SELECT * FROM deployments WHERE user_id = :userId ORDER BY created_at DESC LIMIT :limit")
    Flux<Deployment> findRecentByUserId(UUID userId, int limit);

    @Query("SELECT * FROM deployments WHERE user_id = :userId AND app_id = :appId ORDER BY created_at DESC LIMIT :limit")
    Flux<Deployment> findRecentByUserIdAndAppId(UUID userId, UUID appId, int limit);

    @Modifying
    @Query("UPDATE deployments SET status = 'DEPLOYING' WHERE id = :id AND status = 'PENDING'")
    Mono<Integer> markDeploying(UUID id);

    @Modifying
    @Query("UPDATE deployments SET logs = array_append(logs, :line) WHERE id = :id AND completed_at IS NULL")
    Mono<Integer> appendLog(UUID id, String line);

    @Modifying
    @Query("UPDATE deployments SET status = 'RUNNING', completed_at = :completedAt "
            + "WHERE id = :id AND status = 'DEPLOYING' AND completed_at IS NULL")
    Mono<Integer> markRunning(UUID id, LocalDateTime completedAt);

    /**
     * Terminal failure: status, completion time and the error line in one statement.
     */
    @Modifying
    @Query("UPDATE deployments SET status = 'FAILED', completed_at = :completedAt, "
            + "logs = array_append(logs, :errorLine) WHERE id = :id AND completed_at IS NULL")
    Mono<Integer> markFailed(UUID id, LocalDateTime completedAt, String errorLine);

    @Modifying
    @Query("DELETE FROM deployments WHERE app_id = :appId")
    Mono<Integer> deleteByAppId(UUID appId);

    @Modifying
    @Query("DELETE FROM deployments WHERE user_id = :userId")
    Mono<Integer> deleteByUserId(UUID userId);
}
