package com.clouddeploy.repository;

import com.clouddeploy.model.entity.User;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for User entities.
 */
@Repository
public interface UserRepository extends ReactiveCrudRepository<User, UUID> {

    Mono<User> findByEmail(String email);

    Mono<User> findByUsername(String username);

    /**
     * Check whether either identifier is already taken.
     */
    @Query("SELECT EXISTS(SELECT 1 FROM users WHERE email = :email OR username = :username)")
    Mono<Boolean> existsByEmailOrUsername(String email, String username);

    @Query("SELECT EXISTS(SELECT 1 FROM users WHERE email = :email AND id <> :excludedId)")
    Mono<Boolean> existsByEmailExcluding(String email, UUID excludedId);

    @Query("SELECT EXISTS(SELECT 1 FROM users WHERE username = :username AND id <> :excludedId)")
    Mono<Boolean> existsByUsernameExcluding(String username, UUID excludedId);
}
