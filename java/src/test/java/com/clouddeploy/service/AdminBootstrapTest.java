package com.clouddeploy.service;

import com.clouddeploy.config.PlatformProperties;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.model.enums.UserRole;
import com.clouddeploy.repository.UserRepository;
import com.clouddeploy.security.PasswordHasher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for AdminBootstrap.
 */
@ExtendWith(MockitoExtension.class)
class AdminBootstrapTest {

    @Mock
    private UserRepository userRepository;

    private PlatformProperties properties;
    private PasswordHasher passwordHasher;
    private AdminBootstrap bootstrap;

    @BeforeEach
    void setUp() {
        properties = new PlatformProperties();
        properties.getAdmin().setEmail("Root@Example.com");
        properties.getAdmin().setUsername("root");
        properties.getAdmin().setPassword("bootstrap-secret");
        passwordHasher = new PasswordHasher(new BCryptPasswordEncoder(4));
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);
        bootstrap = new AdminBootstrap(properties, userRepository, passwordHasher, clock);
    }

    @Test
    void ensureAdmin_CreatesMissingAdmin() {
        when(userRepository.findByEmail("root@example.com")).thenReturn(Mono.empty());
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        StepVerifier.create(bootstrap.ensureAdmin(properties.getAdmin()))
                .expectNextMatches(User::isAdmin)
                .verifyComplete();

        ArgumentCaptor<User> saved = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(saved.capture());
        assertThat(saved.getValue().getEmail()).isEqualTo("root@example.com");
        assertThat(saved.getValue().getRole()).isEqualTo(UserRole.ADMIN);
        assertThat(saved.getValue().isActive()).isTrue();
        assertThat(passwordHasher.verify("bootstrap-secret", saved.getValue().getPasswordHash())).isTrue();
    }

    @Test
    void ensureAdmin_KeepsExistingAccount() {
        User existing = User.builder()
                .id(UUID.randomUUID())
                .email("root@example.com")
                .role(UserRole.ADMIN)
                .active(true)
                .build();
        when(userRepository.findByEmail("root@example.com")).thenReturn(Mono.just(existing));

        StepVerifier.create(bootstrap.ensureAdmin(properties.getAdmin()))
                .expectNext(existing)
                .verifyComplete();

        verify(userRepository, never()).save(any(User.class));
    }

    @Test
    void run_SkipsWhenDisabled() {
        properties.getAdmin().setBootstrap(false);

        bootstrap.run(null);

        verifyNoInteractions(userRepository);
    }

    @Test
    void run_SkipsWhenPasswordBlank() {
        properties.getAdmin().setBootstrap(true);
        properties.getAdmin().setPassword(" ");

        bootstrap.run(null);

        verifyNoInteractions(userRepository);
    }
}
