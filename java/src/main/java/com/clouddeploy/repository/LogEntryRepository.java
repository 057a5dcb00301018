package com.clouddeploy.repository;

import com.clouddeploy.model.entity.LogEntry;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for platform log entries. Filtered queries go through
 * R2dbcEntityTemplate in LogService.
 */
@Repository
public interface LogEntryRepository extends ReactiveCrudRepository<LogEntry, UUID> {

    @Modifying
    @Query("DELETE FROM logs WHERE app_id = :appId")
    Mono<Integer> deleteByAppId(UUID appId);

    @Modifying
    @Query("DELETE FROM logs WHERE user_id = :userId")
    Mono<Integer> deleteByUserId(UUID userId);
}
