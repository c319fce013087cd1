package com.example.schoolidentity.service;

import com.example.schoolidentity.entity.LockoutState;
import com.example.schoolidentity.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LockoutTrackerTest {

    private static final Instant START = Instant.parse("2024-09-01T08:00:00Z");

    private MutableClock clock;
    private LockoutTracker tracker;
    private LockoutState state;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        tracker = new LockoutTracker(5, Duration.ofHours(2), clock);
        state = new LockoutState();
    }

    @Test
    void fifthFailureLocksForTwoHours() {
        for (int i = 1; i <= 4; i++) {
            assertFalse(tracker.recordFailure(state));
            assertEquals(i, state.getFailedAttempts());
            assertFalse(tracker.isLocked(state));
        }

        assertTrue(tracker.recordFailure(state));

        assertEquals(5, state.getFailedAttempts());
        assertEquals(START.plus(Duration.ofHours(2)), state.getLockedUntil());
        assertTrue(tracker.isLocked(state));
    }

    @Test
    void lockLiftsByItselfOnceCoolDownElapses() {
        state.setFailedAttempts(5);
        state.setLockedUntil(START.plus(Duration.ofHours(2)));

        clock.advance(Duration.ofHours(2).minusSeconds(1));
        assertTrue(tracker.isLocked(state));

        clock.advance(Duration.ofSeconds(1));
        assertFalse(tracker.isLocked(state));
    }

    @Test
    void failureAfterExpiredLockStartsNewWindowAtOne() {
        state.setFailedAttempts(5);
        state.setLockedUntil(START.minusSeconds(1));

        assertFalse(tracker.recordFailure(state));

        assertEquals(1, state.getFailedAttempts());
        assertNull(state.getLockedUntil());
    }

    @Test
    void successResetsCounterAndLock() {
        tracker.recordFailure(state);
        tracker.recordFailure(state);

        tracker.recordSuccess(state);

        assertEquals(0, state.getFailedAttempts());
        assertNull(state.getLockedUntil());
    }

    @Test
    void thresholdMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new LockoutTracker(0, Duration.ofHours(2), clock));
    }
}
