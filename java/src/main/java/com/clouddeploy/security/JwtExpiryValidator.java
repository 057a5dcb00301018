package com.clouddeploy.security;

import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2ErrorCodes;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jwt.Jwt;

import java.time.Clock;
import java.time.Instant;

/**
 * Rejects tokens at or after their expiry instant. No clock skew is allowed.
 */
public class JwtExpiryValidator implements OAuth2TokenValidator<Jwt> {

    private static final OAuth2Error EXPIRED =
            new OAuth2Error(OAuth2ErrorCodes.INVALID_TOKEN, "Token expired", null);

    private static final OAuth2Error MISSING_EXPIRY =
            new OAuth2Error(OAuth2ErrorCodes.INVALID_TOKEN, "Token has no expiry", null);

    private final Clock clock;

    public JwtExpiryValidator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public OAuth2TokenValidatorResult validate(Jwt token) {
        Instant expiresAt = token.getExpiresAt();
        if (expiresAt == null) {
            return OAuth2TokenValidatorResult.failure(MISSING_EXPIRY);
        }
        if (!clock.instant().isBefore(expiresAt)) {
            return OAuth2TokenValidatorResult.failure(EXPIRED);
        }
        return OAuth2TokenValidatorResult.success();
    }
}
