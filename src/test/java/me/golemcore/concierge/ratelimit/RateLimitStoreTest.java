package me.golemcore.concierge.ratelimit;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RateLimitStoreTest {

    @Test
    void shouldReturnTouchedWindowFromPeek() {
        RateLimitStore store = new RateLimitStore(60_000, 10);
        SlidingWindow window = store.touch("t1");

        Optional<SlidingWindow> peeked = store.peek("t1");

        assertTrue(peeked.isPresent());
        assertSame(window, peeked.get());
        assertTrue(store.peek("t2").isEmpty());
    }

    @Test
    void shouldNotRefreshEvictionOrderOnPeek() {
        // Arrange
        RateLimitStore store = new RateLimitStore(60_000, 2);
        store.touch("t1");
        store.touch("t2");

        // Act
        store.peek("t1");
        store.touch("t3");

        // Assert
        assertFalse(store.isTracked("t1"));
        assertTrue(store.peek("t1").isEmpty());
        assertTrue(store.isTracked("t2"));
        assertTrue(store.isTracked("t3"));
    }

    @Test
    void shouldRefreshEvictionOrderOnTouch() {
        RateLimitStore store = new RateLimitStore(60_000, 2);
        SlidingWindow first = store.touch("t1");
        store.touch("t2");

        assertSame(first, store.touch("t1"));
        store.touch("t3");

        assertTrue(store.isTracked("t1"));
        assertFalse(store.isTracked("t2"));
        assertEquals(2, store.trackedTenants());
    }

    @Test
    void shouldForgetRemovedAndClearedWindows() {
        RateLimitStore store = new RateLimitStore(60_000, 10);
        store.touch("t1");
        store.touch("t2");

        store.remove("t1");

        assertTrue(store.peek("t1").isEmpty());
        assertTrue(store.peek("t2").isPresent());

        store.clear();

        assertTrue(store.peek("t2").isEmpty());
        assertEquals(0, store.trackedTenants());
    }
}
