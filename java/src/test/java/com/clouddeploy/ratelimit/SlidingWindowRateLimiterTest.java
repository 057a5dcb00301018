package com.clouddeploy.ratelimit;

import com.clouddeploy.config.PlatformProperties;
import com.clouddeploy.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for SlidingWindowRateLimiter.
 */
class SlidingWindowRateLimiterTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final String ROUTE = "/api/v1/apps";

    private PlatformProperties properties;
    private MutableClock clock;
    private SlidingWindowRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        properties = new PlatformProperties();
        properties.getRateLimit().setRequests(3);
        properties.getRateLimit().setWindow(Duration.ofSeconds(60));
        clock = new MutableClock(T0);
        rateLimiter = new SlidingWindowRateLimiter(properties, clock);
    }

    @Test
    void admit_RejectsFourthRequestWithinWindowAndRecoversAfterIt() {
        assertThat(rateLimiter.admit("10.0.0.1", ROUTE, at(0)).admitted()).isTrue();
        assertThat(rateLimiter.admit("10.0.0.1", ROUTE, at(1)).admitted()).isTrue();
        assertThat(rateLimiter.admit("10.0.0.1", ROUTE, at(2)).admitted()).isTrue();

        RateLimitDecision rejected = rateLimiter.admit("10.0.0.1", ROUTE, at(3));
        assertThat(rejected.admitted()).isFalse();
        assertThat(rejected.remaining()).isZero();
        assertThat(rejected.retryAfter()).isEqualTo(Duration.ofSeconds(57));

        assertThat(rateLimiter.admit("10.0.0.1", ROUTE, at(61)).admitted()).isTrue();
    }

    @Test
    void admit_RejectionIsNotCounted() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.admit("10.0.0.1", ROUTE, at(0));
        }
        for (int i = 0; i < 5; i++) {
            assertThat(rateLimiter.admit("10.0.0.1", ROUTE, at(30)).admitted()).isFalse();
        }

        // Only the three admissions at t=0 were recorded, so the window is clear at t=60
        RateLimitDecision decision = rateLimiter.admit("10.0.0.1", ROUTE, at(60));
        assertThat(decision.admitted()).isTrue();
        assertThat(decision.remaining()).isEqualTo(2);
    }

    @Test
    void admit_EntryLeavesWindowExactlyAtWindowLength() {
        rateLimiter.admit("10.0.0.1", ROUTE, at(0));
        rateLimiter.admit("10.0.0.1", ROUTE, at(10));
        rateLimiter.admit("10.0.0.1", ROUTE, at(20));

        assertThat(rateLimiter.admit("10.0.0.1", ROUTE, at(59)).admitted()).isFalse();
        assertThat(rateLimiter.admit("10.0.0.1", ROUTE, at(60)).admitted()).isTrue();
    }

    @Test
    void admit_ReportsRemainingQuota() {
        assertThat(rateLimiter.admit("10.0.0.1", ROUTE, at(0)).remaining()).isEqualTo(2);
        assertThat(rateLimiter.admit("10.0.0.1", ROUTE, at(1)).remaining()).isEqualTo(1);
        assertThat(rateLimiter.admit("10.0.0.1", ROUTE, at(2)).remaining()).isZero();
        assertThat(rateLimiter.admit("10.0.0.1", ROUTE, at(3)).limit()).isEqualTo(3);
    }

    @Test
    void admit_ClientsAreIndependent() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.admit("10.0.0.1", ROUTE, at(i));
        }

        assertThat(rateLimiter.admit("10.0.0.1", ROUTE, at(5)).admitted()).isFalse();
        assertThat(rateLimiter.admit("10.0.0.2", ROUTE, at(5)).admitted()).isTrue();
    }

    @Test
    void admit_HealthRouteIsExemptAndNotCounted() {
        for (int i = 0; i < 10; i++) {
            assertThat(rateLimiter.admit("10.0.0.1", "/health", at(i)).admitted()).isTrue();
        }

        assertThat(rateLimiter.admit("10.0.0.1", ROUTE, at(11)).remaining()).isEqualTo(2);
    }

    @Test
    void admit_DisabledAlwaysAdmits() {
        properties.getRateLimit().setEnabled(false);

        for (int i = 0; i < 20; i++) {
            assertThat(rateLimiter.admit("10.0.0.1", ROUTE, at(0)).admitted()).isTrue();
        }
        assertThat(rateLimiter.trackedClients()).isZero();
    }

    @Test
    void admit_ConcurrentRequestsAtQuotaBoundaryAdmitExactlyOne() throws Exception {
        properties.getRateLimit().setRequests(1);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            for (int round = 0; round < 50; round++) {
                String clientId = "client-" + round;
                CountDownLatch start = new CountDownLatch(1);
                List<Future<Boolean>> results = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    Callable<Boolean> attempt = () -> {
                        start.await();
                        return rateLimiter.admit(clientId, ROUTE, at(0)).admitted();
                    };
                    results.add(executor.submit(attempt));
                }
                start.countDown();

                int admitted = 0;
                for (Future<Boolean> result : results) {
                    if (result.get(5, TimeUnit.SECONDS)) {
                        admitted++;
                    }
                }
                assertThat(admitted).as("round %d", round).isEqualTo(1);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void evictIdle_DropsClientsWithExpiredWindows() {
        rateLimiter.admit("10.0.0.1", ROUTE, clock.instant());
        clock.advance(Duration.ofSeconds(30));
        rateLimiter.admit("10.0.0.2", ROUTE, clock.instant());

        clock.advance(Duration.ofSeconds(31));
        rateLimiter.evictIdle();

        assertThat(rateLimiter.trackedClients()).isEqualTo(1);
        assertThat(rateLimiter.admit("10.0.0.2", ROUTE, clock.instant()).remaining()).isEqualTo(1);
    }

    private static Instant at(int seconds) {
        return T0.plusSeconds(seconds);
    }
}
