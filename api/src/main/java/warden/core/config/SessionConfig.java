package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for session lifecycle.
 *
 * <p>Configuration prefix: {@code warden.session}
 *
 * <p>Sessions use a sliding timeout capped by an absolute lifetime: every validated
 * request pushes {@code expiresAt} forward by {@link #defaultTimeout()}, but never past
 * {@code createdAt + maxAbsoluteLifetime}.
 *
 * @see warden.core.service.session.SessionService
 */
@ConfigMapping(prefix = "warden.session")
public interface SessionConfig {

    /**
     * Sliding idle timeout.
     *
     * @return timeout (default: 24 hours)
     */
    @WithDefault("PT24H")
    Duration defaultTimeout();

    /**
     * Upper bound on a session's lifetime regardless of activity.
     *
     * @return absolute lifetime (default: 7 days)
     */
    @WithDefault("P7D")
    Duration maxAbsoluteLifetime();

    /**
     * Maximum number of concurrently active sessions per user.
     *
     * <p>Creating a session beyond this limit ends the user's oldest sessions.
     *
     * @return session cap (default: 5)
     */
    @WithDefault("5")
    int maxSessionsPerUser();

    /**
     * Session ID generation settings.
     */
    IdGeneration idGeneration();

    /**
     * Expired-session sweep settings.
     */
    Cleanup cleanup();

    /**
     * Suspicious-activity detection settings.
     */
    SuspiciousActivity suspiciousActivity();

    interface IdGeneration {

        /**
         * Attempts to generate a unique ID before giving up.
         *
         * @return max retries (default: 3)
         */
        @WithDefault("3")
        int maxRetries();
    }

    interface Cleanup {

        /**
         * Enable the scheduled expired-session sweep.
         *
         * @return true if enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Sweep interval, in scheduler syntax.
         *
         * @return interval (default: 5m)
         */
        @WithDefault("5m")
        String interval();
    }

    interface SuspiciousActivity {

        /**
         * Compare user agents with Jaro-Winkler similarity. When disabled, the length
         * heuristic applies instead.
         *
         * @return true if similarity scoring is enabled (default: true)
         */
        @WithDefault("true")
        boolean similarityEnabled();

        /**
         * Minimum length both user agents must have to be compared at all.
         *
         * @return minimum length (default: 10)
         */
        @WithDefault("10")
        int userAgentMinLength();

        /**
         * Similarity below which a user-agent change is suspicious.
         *
         * @return threshold between 0 and 1 (default: 0.8)
         */
        @WithDefault("0.8")
        double similarityThreshold();

        /**
         * Length difference above which unrelated user agents are suspicious, used by
         * the length heuristic.
         *
         * @return threshold in characters (default: 20)
         */
        @WithDefault("20")
        int lengthDifferenceThreshold();
    }
}
