package com.clouddeploy.ratelimit;

import java.time.Duration;

/**
 * Result of an admission check.
 *
 * @param admitted   whether the request may proceed
 * @param limit      configured quota per window
 * @param remaining  slots left in the current window after this request
 * @param retryAfter time until a slot frees up; null when admitted
 */
public record RateLimitDecision(boolean admitted, int limit, int remaining, Duration retryAfter) {

    public static RateLimitDecision admit(int limit, int remaining) {
        return new RateLimitDecision(true, limit, remaining, null);
    }

    public static RateLimitDecision reject(int limit, Duration retryAfter) {
        return new RateLimitDecision(false, limit, 0, retryAfter);
    }

    /**
     * Decision for requests that are not counted at all.
     */
    public static RateLimitDecision unlimited(int limit) {
        return new RateLimitDecision(true, limit, limit, null);
    }
}
