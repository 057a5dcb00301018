package com.clouddeploy.security;

import com.clouddeploy.config.JwtConfig;
import com.clouddeploy.config.PlatformProperties;
import com.clouddeploy.exception.AccountDisabledException;
import com.clouddeploy.exception.ForbiddenException;
import com.clouddeploy.exception.UnauthenticatedException;
import com.clouddeploy.model.entity.ApiKey;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.model.enums.UserRole;
import com.clouddeploy.repository.ApiKeyRepository;
import com.clouddeploy.repository.UserRepository;
import com.clouddeploy.support.MutableClock;
import com.clouddeploy.util.ApiKeyUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import javax.crypto.SecretKey;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for CredentialService.
 */
@ExtendWith(MockitoExtension.class)
class CredentialServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private ApiKeyRepository apiKeyRepository;

    private MutableClock clock;
    private TokenService tokenService;
    private CredentialService credentialService;

    private User user;
    private User otherUser;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        PlatformProperties properties = new PlatformProperties();
        properties.getAuth().setJwtSecret("credential-test-secret");

        JwtConfig jwtConfig = new JwtConfig();
        SecretKey key = jwtConfig.jwtSigningKey(properties);
        tokenService = new TokenService(jwtConfig.jwtEncoder(key), jwtConfig.jwtDecoder(key, clock), clock, properties);
        credentialService = new CredentialService(tokenService, userRepository, apiKeyRepository);

        user = User.builder()
                .id(UUID.randomUUID())
                .username("alice")
                .email("alice@example.com")
                .role(UserRole.USER)
                .active(true)
                .build();

        otherUser = User.builder()
                .id(UUID.randomUUID())
                .username("bob")
                .email("bob@example.com")
                .role(UserRole.USER)
                .active(true)
                .build();
    }

    @Test
    void authenticate_AccessTokenResolvesSubject() {
        String accessToken = tokenService.issueTokens(user.getId()).accessToken();
        when(userRepository.findById(user.getId())).thenReturn(Mono.just(user));

        StepVerifier.create(credentialService.authenticate(accessToken))
                .expectNext(user)
                .verifyComplete();

        verifyNoInteractions(apiKeyRepository);
    }

    @Test
    void authenticate_RefreshTokenIsRejected() {
        String refreshToken = tokenService.issueTokens(user.getId()).refreshToken();

        StepVerifier.create(credentialService.authenticate(refreshToken))
                .expectError(UnauthenticatedException.class)
                .verify();

        verify(userRepository, never()).findById(any(UUID.class));
    }

    @Test
    void authenticate_ApiKeyResolvesOwningUser() {
        String secret = ApiKeyUtil.generateApiKey("cdp_", 32);
        ApiKey key = ApiKey.builder()
                .id(UUID.randomUUID())
                .userId(user.getId())
                .keyHash(ApiKeyUtil.hashApiKey(secret))
                .build();
        when(apiKeyRepository.findByKeyHash(ApiKeyUtil.hashApiKey(secret))).thenReturn(Mono.just(key));
        when(apiKeyRepository.updateLastUsed(key.getId())).thenReturn(Mono.just(1));
        when(userRepository.findById(user.getId())).thenReturn(Mono.just(user));

        StepVerifier.create(credentialService.authenticate(secret))
                .expectNext(user)
                .verifyComplete();

        verify(userRepository, never()).findById(otherUser.getId());
        verify(apiKeyRepository).updateLastUsed(key.getId());
    }

    @Test
    void authenticate_UsageRecordingFailureDoesNotFailRequest() {
        String secret = ApiKeyUtil.generateApiKey("cdp_", 32);
        ApiKey key = ApiKey.builder().id(UUID.randomUUID()).userId(user.getId()).build();
        when(apiKeyRepository.findByKeyHash(anyString())).thenReturn(Mono.just(key));
        when(apiKeyRepository.updateLastUsed(key.getId())).thenReturn(Mono.error(new IllegalStateException("db down")));
        when(userRepository.findById(user.getId())).thenReturn(Mono.just(user));

        StepVerifier.create(credentialService.authenticate(secret))
                .expectNext(user)
                .verifyComplete();
    }

    @Test
    void authenticate_UnknownApiKeyIsUnauthenticated() {
        when(apiKeyRepository.findByKeyHash(anyString())).thenReturn(Mono.empty());

        StepVerifier.create(credentialService.authenticate("cdp_unknown"))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(UnauthenticatedException.class)
                        .hasMessage("Could not validate credentials"))
                .verify();
    }

    @Test
    void authenticate_ExpiredTokenIsUnauthenticated() {
        String accessToken = tokenService.issueTokens(user.getId()).accessToken();
        clock.advance(Duration.ofMinutes(60));
        when(apiKeyRepository.findByKeyHash(anyString())).thenReturn(Mono.empty());

        StepVerifier.create(credentialService.authenticate(accessToken))
                .expectError(UnauthenticatedException.class)
                .verify();

        verify(userRepository, never()).findById(any(UUID.class));
    }

    @Test
    void authenticate_TokenForDeletedUserIsUnauthenticated() {
        String accessToken = tokenService.issueTokens(user.getId()).accessToken();
        when(userRepository.findById(user.getId())).thenReturn(Mono.empty());

        StepVerifier.create(credentialService.authenticate(accessToken))
                .expectError(UnauthenticatedException.class)
                .verify();
    }

    @Test
    void authenticate_DisabledAccountIsDistinctFailure() {
        user.setActive(false);
        String accessToken = tokenService.issueTokens(user.getId()).accessToken();
        when(userRepository.findById(user.getId())).thenReturn(Mono.just(user));

        StepVerifier.create(credentialService.authenticate(accessToken))
                .expectError(AccountDisabledException.class)
                .verify();
    }

    @Test
    void authenticate_BlankCredentialIsUnauthenticated() {
        StepVerifier.create(credentialService.authenticate("  "))
                .expectError(UnauthenticatedException.class)
                .verify();

        verifyNoInteractions(userRepository, apiKeyRepository);
    }

    @Test
    void authenticateRefresh_AcceptsRefreshToken() {
        String refreshToken = tokenService.issueTokens(user.getId()).refreshToken();
        when(userRepository.findById(user.getId())).thenReturn(Mono.just(user));

        StepVerifier.create(credentialService.authenticateRefresh(refreshToken))
                .expectNext(user)
                .verifyComplete();
    }

    @Test
    void authenticateRefresh_RejectsAccessTokenAndApiKey() {
        String accessToken = tokenService.issueTokens(user.getId()).accessToken();

        StepVerifier.create(credentialService.authenticateRefresh(accessToken))
                .expectError(UnauthenticatedException.class)
                .verify();

        StepVerifier.create(credentialService.authenticateRefresh(ApiKeyUtil.generateApiKey("cdp_", 32)))
                .expectError(UnauthenticatedException.class)
                .verify();

        verifyNoInteractions(userRepository, apiKeyRepository);
    }

    @Test
    void authorizeAdmin_AllowsAdminOnly() {
        User admin = User.builder().id(UUID.randomUUID()).role(UserRole.ADMIN).active(true).build();

        assertThat(credentialService.authorizeAdmin(admin)).isSameAs(admin);
        assertThatThrownBy(() -> credentialService.authorizeAdmin(user))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("Admin access required");
    }
}
