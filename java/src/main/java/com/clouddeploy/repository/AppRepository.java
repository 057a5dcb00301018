package com.clouddeploy.repository;

import com.clouddeploy.model.entity.App;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for App entities.
 */
@Repository
public interface AppRepository extends ReactiveCrudRepository<App, UUID> {

    Mono<App> findByIdAndUserId(UUID id, UUID userId);

    Flux<App> findByUserId(UUID userId);

    Mono<Long> countByUserId(UUID userId);

    @Query("SELECT EXISTS(SELECT 1 FROM apps WHERE user_id = :userId AND name = :name)")
    Mono<Boolean> existsByUserIdAndName(UUID userId, String name);

    /**
     * Set the denormalized status. Used by the deployment lifecycle once the
     * deployment itself has reached the same status.
     */
    @Modifying
    @Query("UPDATE apps SET status = :status, updated_at = NOW() WHERE id = :id")
    Mono<Integer> updateStatus(UUID id, String status);

    @Modifying
    @Query("DELETE FROM apps WHERE user_id = :userId")
    Mono<Integer> deleteByUserId(UUID userId);
}
