package com.example.schoolidentity.service;

import com.example.schoolidentity.entity.LockoutState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Failed-login counter and temporary lock.
 *
 * Callers must hold the account row lock (see the *ForUpdate repository queries) so each
 * update is a serialized read-modify-write. Lock expiry is evaluated lazily against the clock.
 */
@Service
@Slf4j
public class LockoutTracker {

    private final int maxAttempts;
    private final Duration lockDuration;
    private final Clock clock;

    public LockoutTracker(
            @Value("${identity.lockout.max-attempts:5}") int maxAttempts,
            @Value("${identity.lockout.duration:PT2H}") Duration lockDuration,
            Clock clock) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("identity.lockout.max-attempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.lockDuration = lockDuration;
        this.clock = clock;
    }

    public boolean isLocked(LockoutState state) {
        return state.isLockedAt(clock.instant());
    }

    /**
     * Count a wrong password. Must not be called while the account is locked.
     *
     * @return true if this failure locked the account
     */
    public boolean recordFailure(LockoutState state) {
        Instant now = clock.instant();

        if (state.getLockedUntil() != null && !state.isLockedAt(now)) {
            // previous lock has run out, start a fresh window
            state.setFailedAttempts(1);
            state.setLockedUntil(null);
        } else {
            state.setFailedAttempts(state.getFailedAttempts() + 1);
        }

        if (state.getFailedAttempts() >= maxAttempts) {
            state.setLockedUntil(now.plus(lockDuration));
            log.debug("Lock set until {} after {} failed attempts", state.getLockedUntil(), state.getFailedAttempts());
            return true;
        }
        return false;
    }

    public void recordSuccess(LockoutState state) {
        state.setFailedAttempts(0);
        state.setLockedUntil(null);
    }
}
