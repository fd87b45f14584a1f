package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for progressive account lockout.
 *
 * <p>Configuration prefix: {@code warden.lockout}
 *
 * <p>Lock duration per escalation level. Durations must not decrease from one level
 * to the next; the lockout service refuses to start otherwise.
 *
 * @see warden.core.service.lockout.LockoutService
 */
@ConfigMapping(prefix = "warden.lockout")
public interface LockoutConfig {

    /**
     * Lock duration at 3-4 failed attempts.
     *
     * @return duration (default: 1 minute)
     */
    @WithDefault("PT1M")
    Duration levelOneDuration();

    /**
     * Lock duration at 5-9 failed attempts.
     *
     * @return duration (default: 15 minutes)
     */
    @WithDefault("PT15M")
    Duration levelTwoDuration();

    /**
     * Lock duration at 10-14 failed attempts.
     *
     * @return duration (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration levelThreeDuration();

    /**
     * Lock duration at 15 or more failed attempts.
     *
     * @return duration (default: 24 hours)
     */
    @WithDefault("PT24H")
    Duration levelFourDuration();
}
