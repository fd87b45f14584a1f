package warden.core.model.session;

/**
 * Why a session stopped being active.
 */
public enum SessionEndReason {
    EXPIRED("expired"),
    MANUAL("manual"),
    SUSPICIOUS_ACTIVITY("suspicious_activity"),
    SESSION_LIMIT_EXCEEDED("session_limit_exceeded"),
    SECURITY("security");

    private final String value;

    SessionEndReason(String value) {
        this.value = value;
    }

    /**
     * Return the persisted form of this reason.
     */
    public String value() {
        return value;
    }

    /**
     * Resolve a persisted reason value.
     *
     * @throws IllegalArgumentException if the value is not a known reason
     */
    public static SessionEndReason fromValue(String value) {
        for (SessionEndReason reason : values()) {
            if (reason.value.equals(value)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown session end reason: " + value);
    }
}
