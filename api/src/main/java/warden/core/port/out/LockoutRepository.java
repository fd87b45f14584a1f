package warden.core.port.out;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.IntFunction;
import java.util.function.IntUnaryOperator;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import warden.core.model.lockout.LockoutRecord;
import warden.core.model.lockout.LockoutType;

/**
 * Outbound port for lockout record storage.
 *
 * <p>Records are keyed by (identifier, type) and are never deleted.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Increments MUST be atomic: concurrent failures never lose an increment</li>
 *   <li>The lock for a failure MUST be applied in the same update as its increment</li>
 *   <li>Locks MUST only move {@code lockedUntil} forward</li>
 *   <li>All operations MUST be non-blocking (return Uni/Multi)</li>
 * </ul>
 */
public interface LockoutRepository {

    /**
     * Atomically count one failure and apply the lock the new count calls for.
     *
     * <p>The increment and the lock are a single update: a concurrent {@link #reset}
     * lands either before both or after both, so a reset record is never locked.
     *
     * @param identifier  tracked identifier
     * @param type        identifier type
     * @param now         time of the failure
     * @param levelFor    escalation level for a failed-attempt count (0 for no lock)
     * @param durationFor lock duration for a level of 1 or more
     * @return the record after the update
     */
    Uni<LockoutRecord> recordFailure(
            String identifier,
            LockoutType type,
            Instant now,
            IntUnaryOperator levelFor,
            IntFunction<Duration> durationFor);

    /**
     * Find the record for an identifier.
     */
    Uni<Optional<LockoutRecord>> find(String identifier, LockoutType type);

    /**
     * Reset the failure counter and lock.
     *
     * @param manual whether this is an administrative unlock (counted in {@code unlockAttempts})
     * @return the record after the reset, or empty if there was none
     */
    Uni<Optional<LockoutRecord>> reset(String identifier, LockoutType type, boolean manual);

    /**
     * Stream every stored record.
     */
    Multi<LockoutRecord> streamAll();
}
