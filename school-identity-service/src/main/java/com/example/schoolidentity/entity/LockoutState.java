package com.example.schoolidentity.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Failed-login counter and temporary lock embedded in every account row.
 *
 * Mutated only through {@link com.example.schoolidentity.service.LockoutTracker}.
 * A row that never failed a login carries the zero state.
 */
@Embeddable
@Getter
@Setter
public class LockoutState {

    @Column(name = "failed_login_attempts", nullable = false)
    private int failedAttempts;

    @Column(name = "locked_until")
    private Instant lockedUntil;

    public LockoutState() {
    }

    public LockoutState(int failedAttempts, Instant lockedUntil) {
        this.failedAttempts = failedAttempts;
        this.lockedUntil = lockedUntil;
    }

    /**
     * Locked while the cool-down has not elapsed. Evaluated lazily, nothing clears it in the background.
     */
    public boolean isLockedAt(Instant now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }
}
