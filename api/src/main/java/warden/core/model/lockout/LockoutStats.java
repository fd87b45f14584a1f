package warden.core.model.lockout;

import java.time.Duration;
import java.util.Map;

/**
 * Aggregate lockout counts over a trailing window.
 *
 * @param window          the trailing window the counts cover
 * @param totalLockouts   records whose last lock was applied within the window
 * @param activeLockouts  of those, records still locked now
 * @param lockoutsByLevel count per lock level (1-4)
 * @param lockoutsByType  count per identifier type
 */
public record LockoutStats(
        Duration window,
        int totalLockouts,
        int activeLockouts,
        Map<Integer, Integer> lockoutsByLevel,
        Map<LockoutType, Integer> lockoutsByType) {

    public LockoutStats {
        lockoutsByLevel = Map.copyOf(lockoutsByLevel);
        lockoutsByType = Map.copyOf(lockoutsByType);
    }
}
