package warden.core.model.session;

/**
 * Outcome of validating a session on an authenticated request.
 *
 * <p>An invalid result carries no session. A suspicious-activity flag never
 * makes a result invalid; escalating it is left to the caller.
 *
 * @param valid              whether the session may be used
 * @param session            the refreshed session (null when invalid)
 * @param suspiciousActivity whether this validation raised a suspicious-activity flag
 */
public record SessionValidationResult(boolean valid, Session session, boolean suspiciousActivity) {

    public static SessionValidationResult invalid() {
        return new SessionValidationResult(false, null, false);
    }

    public static SessionValidationResult valid(Session session, boolean suspiciousActivity) {
        return new SessionValidationResult(true, session, suspiciousActivity);
    }
}
