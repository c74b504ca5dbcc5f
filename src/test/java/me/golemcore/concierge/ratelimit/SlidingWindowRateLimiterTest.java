package me.golemcore.concierge.ratelimit;

import me.golemcore.concierge.domain.model.RateLimitResult;
import me.golemcore.concierge.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class SlidingWindowRateLimiterTest {

    private static final String TENANT_A = "tenant-a";
    private static final String TENANT_B = "tenant-b";
    private static final int LIMIT = 3;

    private MutableClock clock;
    private RateLimitStore store;
    private SlidingWindowRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-10T09:00:00Z");
        store = new RateLimitStore(60_000, 100);
        rateLimiter = new SlidingWindowRateLimiter(store, clock);
    }

    // ==================== admit ====================

    @Test
    void shouldDenyCallAfterLimitWithinWindow() {
        // Arrange
        for (int i = 0; i < LIMIT; i++) {
            assertTrue(rateLimiter.admit(TENANT_A, LIMIT).isAllowed());
        }

        // Act
        RateLimitResult result = rateLimiter.admit(TENANT_A, LIMIT);

        // Assert
        assertFalse(result.isAllowed());
        assertEquals(0, result.getRemaining());
        assertNotNull(result.getReason());
        assertTrue(result.getResetInMs() > 0);
    }

    @Test
    void shouldCountDownRemaining() {
        assertEquals(2, rateLimiter.admit(TENANT_A, LIMIT).getRemaining());
        assertEquals(1, rateLimiter.admit(TENANT_A, LIMIT).getRemaining());
        assertEquals(0, rateLimiter.admit(TENANT_A, LIMIT).getRemaining());
    }

    @Test
    void shouldAdmitAgainOnceOldestRequestLeavesWindow() {
        // Arrange
        for (int i = 0; i < LIMIT; i++) {
            rateLimiter.admit(TENANT_A, LIMIT);
            clock.advance(Duration.ofSeconds(10));
        }
        assertFalse(rateLimiter.admit(TENANT_A, LIMIT).isAllowed());

        // Act
        clock.advance(Duration.ofSeconds(31));
        RateLimitResult result = rateLimiter.admit(TENANT_A, LIMIT);

        // Assert
        assertTrue(result.isAllowed());
    }

    @Test
    void shouldKeepTenantsIndependent() {
        for (int i = 0; i < LIMIT; i++) {
            rateLimiter.admit(TENANT_A, LIMIT);
        }

        assertFalse(rateLimiter.admit(TENANT_A, LIMIT).isAllowed());
        assertTrue(rateLimiter.admit(TENANT_B, LIMIT).isAllowed());
    }

    @Test
    void shouldDenyWhenLimitIsNotPositive() {
        RateLimitResult result = rateLimiter.admit(TENANT_A, 0);

        assertFalse(result.isAllowed());
        assertEquals(0, result.getRemaining());
        assertFalse(store.isTracked(TENANT_A));
    }

    // ==================== status ====================

    @Test
    void shouldNotConsumeOnStatus() {
        // Arrange
        rateLimiter.admit(TENANT_A, LIMIT);

        // Act
        RateLimitResult first = rateLimiter.status(TENANT_A, LIMIT);
        RateLimitResult second = rateLimiter.status(TENANT_A, LIMIT);

        // Assert
        assertEquals(2, first.getRemaining());
        assertEquals(2, second.getRemaining());
        assertEquals(1, rateLimiter.admit(TENANT_A, LIMIT).getRemaining());
    }

    @Test
    void shouldReportFullLimitForUnknownTenantWithoutTrackingIt() {
        RateLimitResult result = rateLimiter.status(TENANT_B, LIMIT);

        assertTrue(result.isAllowed());
        assertEquals(LIMIT, result.getRemaining());
        assertFalse(store.isTracked(TENANT_B));
    }

    // ==================== reset ====================

    @Test
    void shouldRestoreFullLimitAfterReset() {
        // Arrange
        for (int i = 0; i < LIMIT; i++) {
            rateLimiter.admit(TENANT_A, LIMIT);
        }

        // Act
        rateLimiter.reset(TENANT_A);

        // Assert
        assertEquals(LIMIT, rateLimiter.status(TENANT_A, LIMIT).getRemaining());
        assertTrue(rateLimiter.admit(TENANT_A, LIMIT).isAllowed());
    }

    @Test
    void shouldClearEveryTenantOnResetAll() {
        rateLimiter.admit(TENANT_A, LIMIT);
        rateLimiter.admit(TENANT_B, LIMIT);

        rateLimiter.resetAll();

        assertEquals(0, store.trackedTenants());
    }

    // ==================== store bounds ====================

    @Test
    void shouldEvictLeastRecentlyUsedTenantWhenStoreIsFull() {
        // Arrange
        RateLimitStore small = new RateLimitStore(60_000, 2);
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(small, clock);
        limiter.admit("t1", LIMIT);
        limiter.admit("t2", LIMIT);
        limiter.admit("t1", LIMIT);

        // Act
        limiter.admit("t3", LIMIT);

        // Assert
        assertEquals(2, small.trackedTenants());
        assertTrue(small.isTracked("t1"));
        assertFalse(small.isTracked("t2"));
        assertTrue(small.isTracked("t3"));
    }

    @Test
    void shouldNeverAdmitMoreThanLimitUnderConcurrency() throws Exception {
        // Arrange
        int limit = 25;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Callable<Boolean>> calls = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            calls.add(() -> rateLimiter.admit(TENANT_A, limit).isAllowed());
        }

        // Act
        int admitted = 0;
        try {
            for (Future<Boolean> future : executor.invokeAll(calls)) {
                if (future.get()) {
                    admitted++;
                }
            }
        } finally {
            executor.shutdownNow();
        }

        // Assert
        assertEquals(limit, admitted);
    }
}
