package com.clouddeploy.service;

import com.clouddeploy.config.PlatformProperties;
import com.clouddeploy.exception.AccountDisabledException;
import com.clouddeploy.exception.DuplicateResourceException;
import com.clouddeploy.exception.InvalidRequestException;
import com.clouddeploy.exception.UnauthenticatedException;
import com.clouddeploy.model.dto.LoginRequest;
import com.clouddeploy.model.dto.RefreshRequest;
import com.clouddeploy.model.dto.SignupRequest;
import com.clouddeploy.model.dto.TokenResponse;
import com.clouddeploy.model.dto.UserResponse;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.model.enums.UserRole;
import com.clouddeploy.repository.UserRepository;
import com.clouddeploy.security.CredentialService;
import com.clouddeploy.security.PasswordHasher;
import com.clouddeploy.security.TokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Service for account signup, password login and token refresh.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    static final String BAD_CREDENTIALS = "Incorrect email or password";

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final TokenService tokenService;
    private final CredentialService credentialService;
    private final PlatformProperties properties;
    private final Clock clock;

    /**
     * Register a new user account with the user role.
     *
     * @param request Signup request
     * @return the created user
     */
    @Transactional
    public Mono<UserResponse> signup(SignupRequest request) {
        if (!PasswordHasher.fitsBcrypt(request.getPassword())) {
            return Mono.error(new InvalidRequestException(
                    "Password must be at most " + PasswordHasher.MAX_PASSWORD_BYTES + " bytes"));
        }
        String email = normalizeEmail(request.getEmail());
        return userRepository.existsByEmailOrUsername(email, request.getUsername())
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.error(new DuplicateResourceException(
                                "User with this email or username already exists"));
                    }

                    LocalDateTime now = LocalDateTime.now(clock);
                    User user = User.builder()
                            .username(request.getUsername())
                            .email(email)
                            .passwordHash(passwordHasher.hash(request.getPassword()))
                            .role(UserRole.USER)
                            .active(true)
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                    return userRepository.save(user);
                })
                .doOnNext(user -> log.info("New user created: {}", user.getEmail()))
                .map(UserResponse::from);
    }

    /**
     * Exchange email and password for a token pair.
     *
     * Unknown emails cost the same bcrypt work as a wrong password.
     */
    public Mono<TokenResponse> login(LoginRequest request) {
        String email = normalizeEmail(request.getEmail());
        return userRepository.findByEmail(email)
                .switchIfEmpty(Mono.defer(() -> {
                    passwordHasher.verifyAgainstDummy(request.getPassword());
                    log.warn("Login attempt for unknown email");
                    return Mono.error(new UnauthenticatedException(BAD_CREDENTIALS));
                }))
                .flatMap(user -> {
                    if (!passwordHasher.verify(request.getPassword(), user.getPasswordHash())) {
                        log.warn("Failed login for user {}", user.getId());
                        return Mono.error(new UnauthenticatedException(BAD_CREDENTIALS));
                    }
                    if (!user.isActive()) {
                        return Mono.error(new AccountDisabledException());
                    }
                    log.info("User logged in: {}", user.getEmail());
                    return Mono.just(issue(user));
                });
    }

    /**
     * Issue a fresh token pair for the holder of a valid refresh token.
     */
    public Mono<TokenResponse> refresh(RefreshRequest request) {
        return credentialService.authenticateRefresh(request.getRefreshToken())
                .map(this::issue);
    }

    private TokenResponse issue(User user) {
        TokenService.SessionTokens tokens = tokenService.issueTokens(user.getId());
        return TokenResponse.builder()
                .accessToken(tokens.accessToken())
                .refreshToken(tokens.refreshToken())
                .expiresInSeconds(properties.getAuth().getAccessTokenTtl().toSeconds())
                .build();
    }

    private static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
