package warden.core.model.lockout;

import java.time.Instant;

/**
 * Current lock state of an identifier.
 *
 * <p>{@code locked} is derived from {@code lockedUntil} at read time, so an expired
 * lock reports unlocked without a write.
 */
public record LockoutStatus(boolean locked, Instant lockedUntil, int failedAttempts) {

    public static LockoutStatus unlocked() {
        return new LockoutStatus(false, null, 0);
    }
}
