package com.clouddeploy.service;

import com.clouddeploy.config.PlatformProperties;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.model.enums.UserRole;
import com.clouddeploy.repository.UserRepository;
import com.clouddeploy.security.PasswordHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Creates the configured admin account at startup when it does not exist yet.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdminBootstrap implements ApplicationRunner {

    private final PlatformProperties properties;
    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final Clock clock;

    @Override
    public void run(ApplicationArguments args) {
        PlatformProperties.Admin admin = properties.getAdmin();
        if (!admin.isBootstrap()) {
            return;
        }
        if (admin.getPassword() == null || admin.getPassword().isBlank()) {
            log.warn("Admin bootstrap enabled but platform.admin.password is blank, skipping");
            return;
        }
        ensureAdmin(admin).block();
    }

    Mono<User> ensureAdmin(PlatformProperties.Admin admin) {
        String email = admin.getEmail().trim().toLowerCase(Locale.ROOT);
        return userRepository.findByEmail(email)
                .doOnNext(existing -> log.info("Admin account {} already exists", email))
                .switchIfEmpty(Mono.defer(() -> {
                    LocalDateTime now = LocalDateTime.now(clock);
                    User user = User.builder()
                            .username(admin.getUsername())
                            .email(email)
                            .passwordHash(passwordHasher.hash(admin.getPassword()))
                            .role(UserRole.ADMIN)
                            .active(true)
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                    return userRepository.save(user)
                            .doOnNext(saved -> log.info("Admin account created: {}", email));
                }));
    }
}
