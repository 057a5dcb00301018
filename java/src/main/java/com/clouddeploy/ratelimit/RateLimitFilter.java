package com.clouddeploy.ratelimit;

import com.clouddeploy.util.ErrorResponseWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;

/**
 * Rejects requests over the per-client quota before security and routing run.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class RateLimitFilter implements WebFilter {

    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final String REJECTION_DETAIL = "Rate limit exceeded. Please try again later.";

    private final SlidingWindowRateLimiter rateLimiter;
    private final ErrorResponseWriter errorResponseWriter;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String route = exchange.getRequest().getPath().value();
        RateLimitDecision decision = rateLimiter.admit(clientId(exchange), route);

        HttpHeaders headers = exchange.getResponse().getHeaders();
        headers.set(LIMIT_HEADER, String.valueOf(decision.limit()));
        headers.set(REMAINING_HEADER, String.valueOf(decision.remaining()));

        if (!decision.admitted()) {
            headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfter().toSeconds()));
            return errorResponseWriter.write(exchange, HttpStatus.TOO_MANY_REQUESTS, REJECTION_DETAIL);
        }
        return chain.filter(exchange);
    }

    static String clientId(ServerWebExchange exchange) {
        InetSocketAddress remote = exchange.getRequest().getRemoteAddress();
        if (remote == null) {
            return "unknown";
        }
        return remote.getAddress() != null ? remote.getAddress().getHostAddress() : remote.getHostString();
    }
}
