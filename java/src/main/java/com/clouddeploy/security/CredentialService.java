package com.clouddeploy.security;

import com.clouddeploy.exception.AccountDisabledException;
import com.clouddeploy.exception.ForbiddenException;
import com.clouddeploy.exception.UnauthenticatedException;
import com.clouddeploy.model.entity.ApiKey;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.repository.ApiKeyRepository;
import com.clouddeploy.repository.UserRepository;
import com.clouddeploy.util.ApiKeyUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Resolves callers from bearer credentials and gates admin operations.
 *
 * A credential is first tried as a signed session token. Only when it is not
 * a valid token is it looked up as an API key secret.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialService {

    private final TokenService tokenService;
    private final UserRepository userRepository;
    private final ApiKeyRepository apiKeyRepository;

    /**
     * Resolve the user behind an access token or API key.
     *
     * @param credential Opaque bearer string
     * @return the active user; errors with UnauthenticatedException or AccountDisabledException
     */
    public Mono<User> authenticate(String credential) {
        if (credential == null || credential.isBlank()) {
            return Mono.error(new UnauthenticatedException());
        }
        return Mono.defer(() -> {
            Optional<TokenService.SessionClaims> claims = tokenService.decode(credential);
            Mono<User> resolved = claims.isPresent()
                    ? resolveSessionToken(claims.get(), TokenKind.ACCESS)
                    : resolveApiKey(credential);
            return resolved
                    .switchIfEmpty(Mono.error(new UnauthenticatedException()))
                    .flatMap(this::requireActive);
        });
    }

    /**
     * Resolve the user behind a refresh token. API keys and access tokens are rejected.
     */
    public Mono<User> authenticateRefresh(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return Mono.error(new UnauthenticatedException("Invalid refresh token"));
        }
        return Mono.defer(() -> tokenService.decode(refreshToken)
                .map(claims -> resolveSessionToken(claims, TokenKind.REFRESH))
                .orElseGet(() -> Mono.error(new UnauthenticatedException("Invalid refresh token")))
                .switchIfEmpty(Mono.error(new UnauthenticatedException("Invalid refresh token")))
                .flatMap(this::requireActive));
    }

    /**
     * Require the admin role.
     *
     * @throws ForbiddenException for any other role
     */
    public User authorizeAdmin(User user) {
        if (user == null || !user.isAdmin()) {
            throw new ForbiddenException("Admin access required");
        }
        return user;
    }

    private Mono<User> resolveSessionToken(TokenService.SessionClaims claims, TokenKind expected) {
        if (claims.kind() != expected) {
            log.warn("Rejected {} token presented where {} token is required", claims.kind(), expected);
            return Mono.error(new UnauthenticatedException());
        }
        return userRepository.findById(claims.subject());
    }

    private Mono<User> resolveApiKey(String credential) {
        String keyHash = ApiKeyUtil.hashApiKey(credential);
        return apiKeyRepository.findByKeyHash(keyHash)
                .flatMap(key -> {
                    recordUsage(key);
                    return userRepository.findById(key.getUserId());
                });
    }

    private void recordUsage(ApiKey key) {
        apiKeyRepository.updateLastUsed(key.getId())
                .subscribe(updated -> { }, error -> log.warn("Failed to record usage of API key {}", key.getId(), error));
    }

    private Mono<User> requireActive(User user) {
        if (!user.isActive()) {
            log.warn("Rejected credential for disabled account {}", user.getId());
            return Mono.error(new AccountDisabledException());
        }
        return Mono.just(user);
    }
}
