package warden.core.model.lockout;

import java.time.Instant;

/**
 * Outcome of recording a failed authentication attempt.
 *
 * @param attempts    failed attempts after this one
 * @param locked      whether the identifier is now locked
 * @param lockLevel   escalation level computed from {@code attempts}
 * @param lockedUntil end of the lock (null when not locked)
 */
public record FailedAttemptResult(int attempts, boolean locked, int lockLevel, Instant lockedUntil) {}
