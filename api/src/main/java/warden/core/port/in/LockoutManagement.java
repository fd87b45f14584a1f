package warden.core.port.in;

import java.time.Duration;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import warden.core.model.common.ClientMetadata;
import warden.core.model.lockout.FailedAttemptResult;
import warden.core.model.lockout.LockoutRecord;
import warden.core.model.lockout.LockoutStats;
import warden.core.model.lockout.LockoutStatus;
import warden.core.model.lockout.LockoutType;

/**
 * Inbound port for progressive account lockout.
 *
 * <p>The orchestrator checks the lockout before verifying credentials, records every
 * failure, and clears the lockout after every success. This port never infers success
 * on its own.
 */
public interface LockoutManagement {

    /**
     * Records a failed authentication attempt and escalates the lock.
     *
     * @param identifier email address or IP address
     * @param type       identifier type
     * @param client     client metadata of the failed attempt
     * @return attempts so far and the resulting lock state
     */
    Uni<FailedAttemptResult> recordFailedAttempt(String identifier, LockoutType type, ClientMetadata client);

    /**
     * Reports whether an identifier is currently locked.
     */
    Uni<LockoutStatus> checkLockout(String identifier, LockoutType type);

    /**
     * Resets the failure counter and lock after a successful authentication.
     *
     * @return true if a record existed and was reset
     */
    Uni<Boolean> clearLockout(String identifier, LockoutType type);

    /**
     * Resets the failure counter and lock.
     *
     * @param manual true for an administrative unlock, which is counted and audited
     * @return true if a record existed and was reset
     */
    Uni<Boolean> clearLockout(String identifier, LockoutType type, boolean manual);

    /**
     * Aggregates lockouts applied within a trailing window.
     */
    Uni<LockoutStats> getLockoutStats(Duration window);

    /**
     * Streams the records that are locked right now.
     */
    Multi<LockoutRecord> streamLockouts();

    /**
     * Maps a failed-attempt count to its escalation level (0 means no lock).
     */
    int calculateLockoutLevel(int attempts);

    /**
     * Returns the lock duration for an escalation level.
     *
     * @throws IllegalArgumentException if the level is not between 1 and 4
     */
    Duration lockoutDuration(int level);
}
