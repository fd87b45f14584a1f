package warden.core.model.session;

import java.time.Duration;
import java.time.Instant;

/**
 * Represents one authenticated client instance of a user.
 *
 * <p>Sessions are created after the orchestrator has verified credentials and are
 * mutated on every validated request. A session is either active (no {@code endedAt})
 * or ended (with {@code endedAt} and {@code endReason}); never both.
 *
 * @param id                       64 lowercase hex characters (256 bits of randomness)
 * @param userId                   owning user
 * @param createdAt                creation timestamp
 * @param lastActivityAt           last validated activity
 * @param expiresAt                sliding expiration, never moved backward
 * @param endedAt                  when the session ended (null while active)
 * @param endReason                why the session ended (null while active)
 * @param ipAddress                client IP bound at creation
 * @param userAgent                client user agent bound at creation (may be null)
 * @param mobile                   whether the client is a mobile device
 * @param active                   true until the session ends
 * @param activityCount            number of validated activities, including creation
 * @param suspiciousActivityCount  number of positive suspicious-activity detections
 * @param lastSuspiciousActivityAt last positive detection (may be null)
 */
public record Session(
        String id,
        String userId,
        Instant createdAt,
        Instant lastActivityAt,
        Instant expiresAt,
        Instant endedAt,
        SessionEndReason endReason,
        String ipAddress,
        String userAgent,
        boolean mobile,
        boolean active,
        long activityCount,
        long suspiciousActivityCount,
        Instant lastSuspiciousActivityAt) {

    /**
     * Creates a freshly issued, active session.
     */
    public static Session create(
            String id,
            String userId,
            Instant createdAt,
            Instant expiresAt,
            String ipAddress,
            String userAgent,
            boolean mobile) {
        return new Session(
                id, userId, createdAt, createdAt, expiresAt, null, null, ipAddress, userAgent, mobile, true, 1, 0,
                null);
    }

    /**
     * Creates a copy with a different ID (used on ID collision retry).
     */
    public Session withId(String id) {
        return new Session(
                id,
                userId,
                createdAt,
                lastActivityAt,
                expiresAt,
                endedAt,
                endReason,
                ipAddress,
                userAgent,
                mobile,
                active,
                activityCount,
                suspiciousActivityCount,
                lastSuspiciousActivityAt);
    }

    /**
     * Records one validated activity and slides the expiration.
     *
     * <p>The expiration never moves backward: if {@code slidExpiresAt} is earlier than
     * the current value, the current value is kept.
     */
    public Session withActivity(Instant at, Instant slidExpiresAt) {
        Instant newExpiresAt = slidExpiresAt.isAfter(expiresAt) ? slidExpiresAt : expiresAt;
        return new Session(
                id,
                userId,
                createdAt,
                at,
                newExpiresAt,
                endedAt,
                endReason,
                ipAddress,
                userAgent,
                mobile,
                active,
                activityCount + 1,
                suspiciousActivityCount,
                lastSuspiciousActivityAt);
    }

    /**
     * Records a positive suspicious-activity detection.
     */
    public Session withSuspiciousActivity(Instant at) {
        return new Session(
                id,
                userId,
                createdAt,
                lastActivityAt,
                expiresAt,
                endedAt,
                endReason,
                ipAddress,
                userAgent,
                mobile,
                active,
                activityCount,
                suspiciousActivityCount + 1,
                at);
    }

    /**
     * Ends the session.
     */
    public Session ended(SessionEndReason reason, Instant at) {
        return new Session(
                id,
                userId,
                createdAt,
                lastActivityAt,
                expiresAt,
                at,
                reason,
                ipAddress,
                userAgent,
                mobile,
                false,
                activityCount,
                suspiciousActivityCount,
                lastSuspiciousActivityAt);
    }

    /**
     * Checks if the session has expired at the given instant.
     */
    public boolean isExpiredAt(Instant now) {
        return expiresAt.isBefore(now);
    }

    /**
     * Returns the latest instant this session may ever expire at.
     */
    public Instant absoluteExpiry(Duration maxAbsoluteLifetime) {
        return createdAt.plus(maxAbsoluteLifetime);
    }
}
