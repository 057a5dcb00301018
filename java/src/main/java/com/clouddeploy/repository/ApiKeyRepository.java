package com.clouddeploy.repository;

import com.clouddeploy.model.entity.ApiKey;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for API Key entities.
 */
@Repository
public interface ApiKeyRepository extends ReactiveCrudRepository<ApiKey, UUID> {

    /**
     * Find API key by secret digest. The column is uniquely indexed.
     */
    Mono<ApiKey> findByKeyHash(String keyHash);

    Flux<ApiKey> findByUserIdOrderByCreatedAtAsc(UUID userId);

    @Modifying
    @Query("DELETE FROM api_keys WHERE id = :id AND user_id = :userId")
    Mono<Integer> deleteByIdAndUserId(UUID id, UUID userId);

    @Modifying
    @Query("DELETE FROM api_keys WHERE user_id = :userId")
    Mono<Integer> deleteByUserId(UUID userId);

    /**
     * Update last used timestamp.
     */
    @Modifying
    @Query("UPDATE api_keys SET last_used_at = NOW() WHERE id = :id")
    Mono<Integer> updateLastUsed(UUID id);
}
