package com.clouddeploy.service;

import com.clouddeploy.exception.InvalidRequestException;
import com.clouddeploy.exception.ResourceNotFoundException;
import com.clouddeploy.model.dto.LogResponse;
import com.clouddeploy.model.entity.LogEntry;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.repository.AppRepository;
import com.clouddeploy.repository.LogEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Criteria;
import org.springframework.data.relational.core.query.Query;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Service for writing and querying platform log entries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LogService {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    private static final String LEVEL_INFO = "info";

    private final LogEntryRepository logEntryRepository;
    private final AppRepository appRepository;
    private final R2dbcEntityTemplate template;
    private final Clock clock;

    public Mono<LogEntry> recordAppEvent(UUID userId, UUID appId, String logType, String message) {
        return save(LogEntry.builder()
                .userId(userId)
                .appId(appId)
                .logType(logType)
                .message(message));
    }

    public Mono<LogEntry> recordDeploymentEvent(UUID userId, UUID appId, UUID deploymentId, String message) {
        return save(LogEntry.builder()
                .userId(userId)
                .appId(appId)
                .deploymentId(deploymentId)
                .logType(LogEntry.TYPE_DEPLOYMENT)
                .message(message));
    }

    public Mono<LogEntry> recordFunctionEvent(UUID userId, UUID functionId, String message) {
        return save(LogEntry.builder()
                .userId(userId)
                .functionId(functionId)
                .logType(LogEntry.TYPE_FUNCTION_EXECUTION)
                .message(message));
    }

    /**
     * Query the caller's log entries, newest first.
     *
     * @param user         Caller; only their entries are returned
     * @param appId        Optional app filter; must be one of the caller's apps
     * @param deploymentId Optional deployment filter
     * @param functionId   Optional function filter
     * @param logType      Optional type filter
     * @param limit        Maximum entries, 1 to 1000
     */
    public Flux<LogResponse> getLogs(User user, UUID appId, UUID deploymentId, UUID functionId,
                                     String logType, Integer limit) {
        int pageSize = limit == null ? DEFAULT_LIMIT : limit;
        if (pageSize < 1 || pageSize > MAX_LIMIT) {
            return Flux.error(new InvalidRequestException("Limit must be between 1 and " + MAX_LIMIT));
        }

        Mono<Boolean> appCheck = appId == null
                ? Mono.just(true)
                : appRepository.findByIdAndUserId(appId, user.getId())
                        .map(app -> true)
                        .switchIfEmpty(Mono.error(new ResourceNotFoundException("App")));

        return appCheck.flatMapMany(ok -> {
            Criteria criteria = Criteria.where("userId").is(user.getId());
            if (appId != null) {
                criteria = criteria.and("appId").is(appId);
            }
            if (deploymentId != null) {
                criteria = criteria.and("deploymentId").is(deploymentId);
            }
            if (functionId != null) {
                criteria = criteria.and("functionId").is(functionId);
            }
            if (logType != null && !logType.isBlank()) {
                criteria = criteria.and("logType").is(logType);
            }

            Query query = Query.query(criteria)
                    .sort(Sort.by(Sort.Direction.DESC, "createdAt"))
                    .limit(pageSize);
            return template.select(query, LogEntry.class);
        }).map(LogResponse::from);
    }

    private Mono<LogEntry> save(LogEntry.LogEntryBuilder builder) {
        LogEntry entry = builder
                .level(LEVEL_INFO)
                .createdAt(LocalDateTime.now(clock))
                .build();
        return logEntryRepository.save(entry)
                .doOnNext(saved -> log.debug("Recorded {} log: {}", saved.getLogType(), saved.getMessage()));
    }
}
