package warden.core.model.lockout;

import java.time.Instant;

/**
 * Failed-attempt counter and lock state for one (identifier, type) pair.
 *
 * <p>Records are reset on success or manual clear but never deleted, so they remain
 * available for statistics.
 *
 * @param identifier     email address or IP address
 * @param type           kind of identifier
 * @param failedAttempts failures since the last reset
 * @param firstAttemptAt first failure since the last reset (null after reset)
 * @param lastAttemptAt  most recent failure
 * @param lockedUntil    end of the current lock (null when no lock was applied)
 * @param lockLevel      level of the last lock applied (0 when none, kept across resets)
 * @param lastLockedAt   when the last lock was applied (kept across resets)
 * @param unlockAttempts number of manual unlocks
 */
public record LockoutRecord(
        String identifier,
        LockoutType type,
        int failedAttempts,
        Instant firstAttemptAt,
        Instant lastAttemptAt,
        Instant lockedUntil,
        int lockLevel,
        Instant lastLockedAt,
        int unlockAttempts) {

    /**
     * Creates the record for a first failure.
     */
    public static LockoutRecord firstFailure(String identifier, LockoutType type, Instant at) {
        return new LockoutRecord(identifier, type, 1, at, at, null, 0, null, 0);
    }

    /**
     * Records one more failure.
     */
    public LockoutRecord withFailure(Instant at) {
        Instant first = firstAttemptAt != null ? firstAttemptAt : at;
        return new LockoutRecord(
                identifier, type, failedAttempts + 1, first, at, lockedUntil, lockLevel, lastLockedAt, unlockAttempts);
    }

    /**
     * Applies a lock. A lock that would end earlier than the current one is ignored.
     */
    public LockoutRecord withLock(int level, Instant until, Instant at) {
        if (lockedUntil != null && !until.isAfter(lockedUntil)) {
            return this;
        }
        return new LockoutRecord(
                identifier, type, failedAttempts, firstAttemptAt, lastAttemptAt, until, level, at, unlockAttempts);
    }

    /**
     * Resets the counter and lock. The last lock level and time are kept for statistics.
     * Manual resets are counted as unlocks.
     */
    public LockoutRecord reset(boolean manual) {
        return new LockoutRecord(
                identifier,
                type,
                0,
                null,
                lastAttemptAt,
                null,
                lockLevel,
                lastLockedAt,
                manual ? unlockAttempts + 1 : unlockAttempts);
    }

    public boolean isLockedAt(Instant now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }
}
