package warden.core.model.audit;

import java.time.Instant;

/**
 * Filters for reading the audit log. Null filters match everything.
 *
 * <p>Results are returned newest first and capped at {@code limit}.
 */
public record SecurityEventQuery(
        Instant from, Instant to, String userId, SecurityEventType eventType, Severity severity, int limit) {

    public static final int DEFAULT_LIMIT = 1000;

    public SecurityEventQuery {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
    }

    public static SecurityEventQuery all() {
        return new SecurityEventQuery(null, null, null, null, null, DEFAULT_LIMIT);
    }

    public SecurityEventQuery between(Instant from, Instant to) {
        return new SecurityEventQuery(from, to, userId, eventType, severity, limit);
    }

    public SecurityEventQuery forUser(String userId) {
        return new SecurityEventQuery(from, to, userId, eventType, severity, limit);
    }

    public SecurityEventQuery ofType(SecurityEventType eventType) {
        return new SecurityEventQuery(from, to, userId, eventType, severity, limit);
    }

    public SecurityEventQuery withSeverity(Severity severity) {
        return new SecurityEventQuery(from, to, userId, eventType, severity, limit);
    }

    public SecurityEventQuery limit(int limit) {
        return new SecurityEventQuery(from, to, userId, eventType, severity, limit);
    }

    /**
     * Check whether an event passes every filter. {@code from} and {@code to} are inclusive.
     */
    public boolean matches(SecurityEvent event) {
        if (from != null && event.createdAt().isBefore(from)) {
            return false;
        }
        if (to != null && event.createdAt().isAfter(to)) {
            return false;
        }
        if (userId != null && !userId.equals(event.userId())) {
            return false;
        }
        if (eventType != null && eventType != event.eventType()) {
            return false;
        }
        return severity == null || severity == event.severity();
    }
}
