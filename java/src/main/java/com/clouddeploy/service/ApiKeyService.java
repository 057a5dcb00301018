package com.clouddeploy.service;

import com.clouddeploy.config.PlatformProperties;
import com.clouddeploy.exception.ResourceNotFoundException;
import com.clouddeploy.model.dto.ApiKeyCreateRequest;
import com.clouddeploy.model.dto.ApiKeyResponse;
import com.clouddeploy.model.entity.ApiKey;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.repository.ApiKeyRepository;
import com.clouddeploy.util.ApiKeyUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Service for a user's API keys.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApiKeyService {

    private final ApiKeyRepository apiKeyRepository;
    private final PlatformProperties properties;
    private final Clock clock;

    /**
     * Generate a new API key for the user.
     *
     * @param user    Key owner
     * @param request Key name
     * @return the key record carrying the full secret; it is not retrievable later
     */
    public Mono<ApiKeyResponse> createApiKey(User user, ApiKeyCreateRequest request) {
        PlatformProperties.Auth auth = properties.getAuth();
        String secret = ApiKeyUtil.generateApiKey(auth.getApiKeyPrefix(), auth.getApiKeyLength());

        ApiKey key = ApiKey.builder()
                .userId(user.getId())
                .name(request.getName())
                .keyHash(ApiKeyUtil.hashApiKey(secret))
                .keyPrefix(ApiKeyUtil.displayPrefix(secret))
                .keySuffix(ApiKeyUtil.displaySuffix(secret))
                .createdAt(LocalDateTime.now(clock))
                .build();

        return apiKeyRepository.save(key)
                .doOnNext(saved -> log.info("API key {} created for user {}", saved.getId(), user.getId()))
                .map(saved -> toResponse(saved, secret));
    }

    /**
     * List the user's keys in creation order, masked.
     */
    public Flux<ApiKeyResponse> listApiKeys(User user) {
        return apiKeyRepository.findByUserIdOrderByCreatedAtAsc(user.getId())
                .map(key -> toResponse(key, key.maskedKey()));
    }

    public Mono<Void> deleteApiKey(User user, UUID keyId) {
        return apiKeyRepository.deleteByIdAndUserId(keyId, user.getId())
                .flatMap(deleted -> {
                    if (deleted == 0) {
                        return Mono.error(new ResourceNotFoundException("API key"));
                    }
                    log.info("API key {} deleted for user {}", keyId, user.getId());
                    return Mono.<Void>empty();
                });
    }

    private static ApiKeyResponse toResponse(ApiKey key, String shownKey) {
        return ApiKeyResponse.builder()
                .id(key.getId().toString())
                .name(key.getName())
                .key(shownKey)
                .createdAt(key.getCreatedAt())
                .lastUsedAt(key.getLastUsedAt())
                .build();
    }
}
