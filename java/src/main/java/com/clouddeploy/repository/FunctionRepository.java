package com.clouddeploy.repository;

import com.clouddeploy.model.entity.PlatformFunction;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for serverless functions.
 */
@Repository
public interface FunctionRepository extends ReactiveCrudRepository<PlatformFunction, UUID> {

    Mono<PlatformFunction> findByIdAndUserId(UUID id, UUID userId);

    Flux<PlatformFunction> findByUserId(UUID userId);

    @Query("SELECT EXISTS(SELECT 1 FROM functions WHERE user_id = :userId AND name = :name)")
    Mono<Boolean> existsByUserIdAndName(UUID userId, String name);

    @Modifying
    @Query("DELETE FROM functions WHERE user_id = :userId")
    Mono<Integer> deleteByUserId(UUID userId);
}
