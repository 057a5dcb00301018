package com.clouddeploy.security;

import com.clouddeploy.config.PlatformProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and decodes stateless HS256 session tokens.
 *
 * Validity depends only on signature and expiry; there is no revocation list.
 * Access and refresh tokens share the claim shape and differ in the
 * {@code token_type} claim and lifetime.
 */
@Slf4j
@Service
public class TokenService {

    static final String TOKEN_TYPE_CLAIM = "token_type";

    private final JwtEncoder jwtEncoder;
    private final JwtDecoder jwtDecoder;
    private final Clock clock;
    private final PlatformProperties.Auth auth;

    public TokenService(JwtEncoder jwtEncoder, JwtDecoder jwtDecoder, Clock clock, PlatformProperties properties) {
        this.jwtEncoder = jwtEncoder;
        this.jwtDecoder = jwtDecoder;
        this.clock = clock;
        this.auth = properties.getAuth();
    }

    public SessionTokens issueTokens(UUID userId) {
        // JWT timestamps carry whole seconds
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant accessExpiresAt = now.plus(auth.getAccessTokenTtl());
        Instant refreshExpiresAt = now.plus(auth.getRefreshTokenTtl());
        return new SessionTokens(
                encode(userId, TokenKind.ACCESS, now, accessExpiresAt),
                encode(userId, TokenKind.REFRESH, now, refreshExpiresAt),
                accessExpiresAt,
                refreshExpiresAt);
    }

    /**
     * Decode a bearer string as a session token.
     *
     * @return the claims, or empty when the string is not a well-formed,
     * correctly signed, unexpired token
     */
    public Optional<SessionClaims> decode(String token) {
        Jwt jwt;
        try {
            jwt = jwtDecoder.decode(token);
        } catch (JwtException e) {
            log.debug("Not a valid session token: {}", e.getMessage());
            return Optional.empty();
        }

        if (jwt.getSubject() == null) {
            log.warn("Session token without subject");
            return Optional.empty();
        }
        UUID subject;
        try {
            subject = UUID.fromString(jwt.getSubject());
        } catch (IllegalArgumentException e) {
            log.warn("Session token with unusable subject: {}", jwt.getSubject());
            return Optional.empty();
        }
        TokenKind kind = TokenKind.fromClaim(jwt.getClaimAsString(TOKEN_TYPE_CLAIM));
        return Optional.of(new SessionClaims(subject, kind, jwt.getExpiresAt()));
    }

    private String encode(UUID userId, TokenKind kind, Instant issuedAt, Instant expiresAt) {
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .subject(userId.toString())
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .claim(TOKEN_TYPE_CLAIM, kind.claimValue())
                .build();
        return jwtEncoder.encode(JwtEncoderParameters.from(JwsHeader.with(MacAlgorithm.HS256).build(), claims))
                .getTokenValue();
    }

    public record SessionTokens(String accessToken, String refreshToken,
                                Instant accessExpiresAt, Instant refreshExpiresAt) {
    }

    /**
     * Verified token contents. {@code kind} is null for tokens without a
     * recognised token_type claim.
     */
    public record SessionClaims(UUID subject, TokenKind kind, Instant expiresAt) {
    }
}
