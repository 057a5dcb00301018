package com.clouddeploy.service;

import com.clouddeploy.config.PlatformProperties;
import com.clouddeploy.exception.DuplicateResourceException;
import com.clouddeploy.exception.ResourceNotFoundException;
import com.clouddeploy.model.dto.FunctionCreateRequest;
import com.clouddeploy.model.dto.FunctionInvokeRequest;
import com.clouddeploy.model.dto.FunctionInvokeResponse;
import com.clouddeploy.model.dto.FunctionResponse;
import com.clouddeploy.model.dto.FunctionUpdateRequest;
import com.clouddeploy.model.entity.PlatformFunction;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.repository.FunctionRepository;
import com.clouddeploy.util.JsonColumnMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Service for serverless function definitions.
 *
 * Invocation is simulated: the stored code is never executed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FunctionService {

    static final long SIMULATED_EXECUTION_MS = 125;

    private final FunctionRepository functionRepository;
    private final LogService logService;
    private final JsonColumnMapper jsonColumns;
    private final PlatformProperties properties;
    private final Clock clock;

    @Transactional
    public Mono<FunctionResponse> createFunction(User user, FunctionCreateRequest request) {
        return functionRepository.existsByUserIdAndName(user.getId(), request.getName())
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.error(new DuplicateResourceException("Function", request.getName()));
                    }

                    LocalDateTime now = LocalDateTime.now(clock);
                    PlatformFunction function = PlatformFunction.builder()
                            .userId(user.getId())
                            .name(request.getName())
                            .runtime(request.getRuntime())
                            .code(request.getCode())
                            .handler(request.getHandler() == null ? "main" : request.getHandler())
                            .envVars(jsonColumns.write(request.getEnvVars() == null ? Map.of() : request.getEnvVars()))
                            .timeoutSeconds(request.getTimeout())
                            .endpoint("")
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                    return functionRepository.save(function);
                })
                .flatMap(saved -> {
                    saved.setEndpoint(endpoint(saved));
                    return functionRepository.save(saved);
                })
                .doOnNext(saved -> log.info("Function created: {} by user {}", saved.getName(), user.getId()))
                .map(this::toResponse);
    }

    public Flux<FunctionResponse> listFunctions(User user) {
        return functionRepository.findByUserId(user.getId()).map(this::toResponse);
    }

    public Mono<FunctionResponse> getFunction(User user, UUID functionId) {
        return findOwned(user, functionId).map(this::toResponse);
    }

    @Transactional
    public Mono<FunctionResponse> updateFunction(User user, UUID functionId, FunctionUpdateRequest request) {
        return findOwned(user, functionId)
                .flatMap(function -> {
                    if (request.getCode() != null) {
                        function.setCode(request.getCode());
                    }
                    if (request.getEnvVars() != null) {
                        function.setEnvVars(jsonColumns.write(request.getEnvVars()));
                    }
                    if (request.getTimeout() != null) {
                        function.setTimeoutSeconds(request.getTimeout());
                    }
                    function.setUpdatedAt(LocalDateTime.now(clock));
                    return functionRepository.save(function);
                })
                .doOnNext(function -> log.info("Function updated: {} by user {}", function.getName(), user.getId()))
                .map(this::toResponse);
    }

    public Mono<Void> deleteFunction(User user, UUID functionId) {
        return findOwned(user, functionId)
                .flatMap(function -> functionRepository.delete(function)
                        .doOnSuccess(done -> log.info("Function deleted: {} by user {}", function.getName(), user.getId())));
    }

    /**
     * Record an invocation and return a canned successful result echoing the payload.
     */
    public Mono<FunctionInvokeResponse> invokeFunction(User user, UUID functionId, FunctionInvokeRequest request) {
        return findOwned(user, functionId)
                .flatMap(function -> logService.recordFunctionEvent(user.getId(), function.getId(),
                                "Function " + function.getName() + " invoked")
                        .thenReturn(function))
                .map(function -> {
                    Map<String, Object> output = new HashMap<>();
                    output.put("message", "Function " + function.getName() + " executed successfully");
                    output.put("payload", request == null ? null : request.getPayload());

                    log.info("Function invoked: {} by user {}", function.getName(), user.getId());
                    return FunctionInvokeResponse.builder()
                            .functionId(function.getId().toString())
                            .status("success")
                            .executionTimeMs(SIMULATED_EXECUTION_MS)
                            .output(output)
                            .timestamp(LocalDateTime.now(clock))
                            .build();
                });
    }

    private Mono<PlatformFunction> findOwned(User user, UUID functionId) {
        return functionRepository.findByIdAndUserId(functionId, user.getId())
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Function")));
    }

    private String endpoint(PlatformFunction function) {
        return String.format("https://fn-%s-%s.%s/invoke",
                function.getName(), function.getId().toString().substring(0, 8), properties.getBaseDomain());
    }

    private FunctionResponse toResponse(PlatformFunction function) {
        return FunctionResponse.builder()
                .id(function.getId().toString())
                .name(function.getName())
                .userId(function.getUserId().toString())
                .runtime(function.getRuntime())
                .handler(function.getHandler())
                .envVars(jsonColumns.readStringMap(function.getEnvVars()))
                .timeout(function.getTimeoutSeconds())
                .endpoint(function.getEndpoint())
                .createdAt(function.getCreatedAt())
                .updatedAt(function.getUpdatedAt())
                .build();
    }
}
