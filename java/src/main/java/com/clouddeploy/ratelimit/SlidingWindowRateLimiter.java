package com.clouddeploy.ratelimit;

import com.clouddeploy.config.PlatformProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-client sliding-window request counter held in process memory.
 *
 * Each client owns a deque of admission timestamps (epoch millis). The
 * prune-check-append sequence for one client runs inside
 * {@link ConcurrentMap#compute}, so it is atomic per key while unrelated
 * clients proceed in parallel.
 *
 * State is per instance; running several instances multiplies the
 * effective quota.
 */
@Slf4j
@Component
public class SlidingWindowRateLimiter {

    private final PlatformProperties.RateLimit config;
    private final Clock clock;
    private final ConcurrentMap<String, Deque<Long>> windows = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(PlatformProperties properties, Clock clock) {
        this.config = properties.getRateLimit();
        this.clock = clock;
    }

    /**
     * Admit or reject one request.
     *
     * @param clientId Caller identity, typically the remote address
     * @param route    Request path; the health-check route is never counted
     * @param now      Evaluation instant
     * @return the decision with quota headers
     */
    public RateLimitDecision admit(String clientId, String route, Instant now) {
        int limit = config.getRequests();
        if (!config.isEnabled() || config.getHealthCheckPath().equals(route)) {
            return RateLimitDecision.unlimited(limit);
        }

        long nowMillis = now.toEpochMilli();
        long windowMillis = config.getWindow().toMillis();
        RateLimitDecision[] decision = new RateLimitDecision[1];

        windows.compute(clientId, (key, timestamps) -> {
            Deque<Long> window = timestamps != null ? timestamps : new ArrayDeque<>();
            prune(window, nowMillis, windowMillis);

            if (window.size() >= limit) {
                long oldest = window.isEmpty() ? nowMillis : window.peekFirst();
                decision[0] = RateLimitDecision.reject(limit, retryAfter(oldest, nowMillis, windowMillis));
            } else {
                window.addLast(nowMillis);
                decision[0] = RateLimitDecision.admit(limit, limit - window.size());
            }
            return window;
        });

        if (!decision[0].admitted()) {
            log.warn("Rate limit exceeded for client {} on {}", clientId, route);
        }
        return decision[0];
    }

    public RateLimitDecision admit(String clientId, String route) {
        return admit(clientId, route, clock.instant());
    }

    /**
     * Drop windows whose entries have all aged out.
     */
    @Scheduled(fixedDelayString = "${platform.rate-limit.eviction-interval:PT5M}")
    public void evictIdle() {
        long nowMillis = clock.millis();
        long windowMillis = config.getWindow().toMillis();
        int before = windows.size();
        for (String clientId : windows.keySet()) {
            windows.computeIfPresent(clientId, (key, window) -> {
                prune(window, nowMillis, windowMillis);
                return window.isEmpty() ? null : window;
            });
        }
        int evicted = before - windows.size();
        if (evicted > 0) {
            log.debug("Evicted {} idle rate limit windows", evicted);
        }
    }

    int trackedClients() {
        return windows.size();
    }

    private static void prune(Deque<Long> window, long nowMillis, long windowMillis) {
        while (!window.isEmpty() && nowMillis - window.peekFirst() >= windowMillis) {
            window.pollFirst();
        }
    }

    private static Duration retryAfter(long oldestMillis, long nowMillis, long windowMillis) {
        long waitMillis = Math.max(0, oldestMillis + windowMillis - nowMillis);
        // Round up to whole seconds for the Retry-After header
        long seconds = Math.max(1, (waitMillis + 999) / 1000);
        return Duration.ofSeconds(seconds);
    }
}
