package com.clouddeploy.service;

import com.clouddeploy.exception.DuplicateResourceException;
import com.clouddeploy.model.dto.UserResponse;
import com.clouddeploy.model.dto.UserUpdateRequest;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.repository.ApiKeyRepository;
import com.clouddeploy.repository.AppRepository;
import com.clouddeploy.repository.DeploymentRepository;
import com.clouddeploy.repository.FunctionRepository;
import com.clouddeploy.repository.LogEntryRepository;
import com.clouddeploy.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Service for the caller's own profile.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final ApiKeyRepository apiKeyRepository;
    private final AppRepository appRepository;
    private final DeploymentRepository deploymentRepository;
    private final FunctionRepository functionRepository;
    private final LogEntryRepository logEntryRepository;
    private final Clock clock;

    /**
     * Change username and/or email. Null fields are left unchanged.
     */
    @Transactional
    public Mono<UserResponse> updateProfile(User user, UserUpdateRequest request) {
        String username = request.getUsername();
        String email = request.getEmail() == null ? null : request.getEmail().trim().toLowerCase(Locale.ROOT);

        Mono<Boolean> usernameTaken = username == null
                ? Mono.just(false)
                : userRepository.existsByUsernameExcluding(username, user.getId());
        Mono<Boolean> emailTaken = email == null
                ? Mono.just(false)
                : userRepository.existsByEmailExcluding(email, user.getId());

        return usernameTaken
                .flatMap(taken -> taken
                        ? Mono.<Boolean>error(new DuplicateResourceException("Username already taken"))
                        : emailTaken)
                .flatMap(taken -> {
                    if (taken) {
                        return Mono.error(new DuplicateResourceException("Email already taken"));
                    }
                    if (username != null) {
                        user.setUsername(username);
                    }
                    if (email != null) {
                        user.setEmail(email);
                    }
                    user.setUpdatedAt(LocalDateTime.now(clock));
                    return userRepository.save(user);
                })
                .doOnNext(saved -> log.info("Profile updated for user {}", saved.getId()))
                .map(UserResponse::from);
    }

    /**
     * Delete the account with everything it owns.
     */
    @Transactional
    public Mono<Void> deleteAccount(User user) {
        return logEntryRepository.deleteByUserId(user.getId())
                .then(deploymentRepository.deleteByUserId(user.getId()))
                .then(appRepository.deleteByUserId(user.getId()))
                .then(functionRepository.deleteByUserId(user.getId()))
                .then(apiKeyRepository.deleteByUserId(user.getId()))
                .then(userRepository.deleteById(user.getId()))
                .doOnSuccess(done -> log.info("Account deleted: {}", user.getId()));
    }
}
