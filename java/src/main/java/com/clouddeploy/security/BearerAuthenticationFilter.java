package com.clouddeploy.security;

import com.clouddeploy.exception.AccountDisabledException;
import com.clouddeploy.exception.AuthenticationFailedException;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.util.ErrorResponseWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;

/**
 * Filter for bearer authentication with either a session token or an API key.
 * Sets the resolved User as principal in the security context.
 *
 * Registered inside the security filter chain by SecurityConfig, not as a bean.
 */
@Slf4j
@RequiredArgsConstructor
public class BearerAuthenticationFilter implements WebFilter {

    static final Set<String> PUBLIC_PATHS = Set.of(
            "/",
            "/health",
            "/api/v1/auth/signup",
            "/api/v1/auth/login",
            "/api/v1/auth/refresh"
    );

    private static final String BEARER_PREFIX = "Bearer ";

    private final CredentialService credentialService;
    private final ErrorResponseWriter errorResponseWriter;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();

        if (isPublicEndpoint(path)) {
            return chain.filter(exchange);
        }

        String authHeader = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            log.warn("Missing or invalid Authorization header for {}", path);
            return reject(exchange, HttpStatus.UNAUTHORIZED, "Not authenticated");
        }

        String credential = authHeader.substring(BEARER_PREFIX.length()).trim();

        return credentialService.authenticate(credential)
                .onErrorResume(AuthenticationFailedException.class, error -> {
                    log.warn("Authentication failed for {}: {}", path, error.getMessage());
                    HttpStatus status = error instanceof AccountDisabledException
                            ? HttpStatus.FORBIDDEN
                            : HttpStatus.UNAUTHORIZED;
                    return reject(exchange, status, error.getMessage()).then(Mono.<User>empty());
                })
                .flatMap(user -> chain.filter(exchange)
                        .contextWrite(ReactiveSecurityContextHolder.withAuthentication(toAuthentication(user))));
    }

    static boolean isPublicEndpoint(String path) {
        return PUBLIC_PATHS.contains(path) || path.startsWith("/actuator");
    }

    private Mono<Void> reject(ServerWebExchange exchange, HttpStatus status, String detail) {
        if (status == HttpStatus.UNAUTHORIZED) {
            exchange.getResponse().getHeaders().set(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }
        return errorResponseWriter.write(exchange, status, detail);
    }

    private static UsernamePasswordAuthenticationToken toAuthentication(User user) {
        List<SimpleGrantedAuthority> authorities = List.of(
                new SimpleGrantedAuthority("ROLE_" + user.getRole().name()));
        return new UsernamePasswordAuthenticationToken(user, null, authorities);
    }
}
