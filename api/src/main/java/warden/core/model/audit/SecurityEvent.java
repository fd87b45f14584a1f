package warden.core.model.audit;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import warden.core.model.common.ClientMetadata;

/**
 * Immutable audit log entry.
 *
 * <p>Events are built without a sequence; the event store assigns one on append.
 *
 * @param sequence    store-assigned position (0 before append)
 * @param userId      affected user (may be null)
 * @param sessionId   affected session (may be null)
 * @param eventType   what happened
 * @param severity    how serious it is
 * @param description human-readable summary
 * @param ipAddress   client IP, {@code "unknown"} when not available
 * @param userAgent   client user agent (may be null)
 * @param metadata    additional structured attributes
 * @param createdAt   when the event happened
 */
public record SecurityEvent(
        long sequence,
        String userId,
        String sessionId,
        SecurityEventType eventType,
        Severity severity,
        String description,
        String ipAddress,
        String userAgent,
        Map<String, Object> metadata,
        Instant createdAt) {

    public SecurityEvent {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(createdAt, "createdAt");
        ipAddress = ipAddress != null ? ipAddress : ClientMetadata.UNKNOWN_IP;
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public SecurityEvent withSequence(long sequence) {
        return new SecurityEvent(
                sequence, userId, sessionId, eventType, severity, description, ipAddress, userAgent, metadata,
                createdAt);
    }

    public static Builder builder(SecurityEventType eventType, Severity severity) {
        return new Builder(eventType, severity);
    }

    /**
     * Builder for security events.
     */
    public static final class Builder {

        private final SecurityEventType eventType;
        private final Severity severity;
        private String userId;
        private String sessionId;
        private String description;
        private String ipAddress;
        private String userAgent;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private Instant createdAt;

        private Builder(SecurityEventType eventType, Severity severity) {
            this.eventType = eventType;
            this.severity = severity;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder client(ClientMetadata client) {
            if (client != null) {
                this.ipAddress = client.ipAddress();
                this.userAgent = client.userAgent();
            }
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        /**
         * Adds a metadata attribute. Null values are skipped.
         */
        public Builder metadata(String key, Object value) {
            if (value != null) {
                this.metadata.put(key, value);
            }
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public SecurityEvent build() {
            return new SecurityEvent(
                    0L,
                    userId,
                    sessionId,
                    eventType,
                    severity,
                    description,
                    ipAddress,
                    userAgent,
                    metadata,
                    createdAt != null ? createdAt : Instant.now());
        }
    }
}
