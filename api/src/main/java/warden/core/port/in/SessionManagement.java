package warden.core.port.in;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.common.ClientMetadata;
import warden.core.model.session.Session;
import warden.core.model.session.SessionEndReason;
import warden.core.model.session.SessionValidationResult;

/**
 * Inbound port for session management operations.
 *
 * <p>Sessions are created by the authentication orchestrator after credentials (and a
 * second factor, when enabled) have been verified, and validated on every
 * authenticated request.
 */
public interface SessionManagement {

    /**
     * Creates a new session for an authenticated user.
     *
     * <p>When the user already holds the maximum number of active sessions, the oldest
     * ones are ended to make room. The ID is generated with collision detection and
     * retried up to the configured maximum attempts.
     *
     * @param userId user identifier
     * @param client client metadata captured at login
     * @return the created session
     * @throws SessionCreationException if no unique ID could be generated
     */
    Uni<Session> createSession(String userId, ClientMetadata client);

    /**
     * Validates a session and records the activity.
     *
     * <p>Unknown, ended and expired sessions yield an invalid result; an expired session
     * is ended as a side effect. A valid session has its expiration slid forward and is
     * checked for suspicious activity against the incoming client metadata.
     *
     * @param sessionId session identifier
     * @param client    client metadata of the current request
     * @return the validation result
     */
    Uni<SessionValidationResult> validateAndUpdateSession(String sessionId, ClientMetadata client);

    /**
     * Retrieves a session without touching it.
     *
     * @param sessionId session identifier
     * @return the session (active or ended), or empty if not found
     */
    Uni<Optional<Session>> getSession(String sessionId);

    /**
     * Ends a single session.
     *
     * @param sessionId session identifier
     * @param reason    why the session is ended
     * @return true if the session was active and is now ended, false otherwise
     */
    Uni<Boolean> invalidateSession(String sessionId, SessionEndReason reason);

    /**
     * Ends every active session of a user (logout everywhere, password change).
     *
     * @param userId user identifier
     * @param reason why the sessions are ended
     * @return number of sessions ended
     */
    Uni<Integer> invalidateAllUserSessions(String userId, SessionEndReason reason);

    /**
     * Lists a user's active sessions, most recently active first.
     *
     * @param userId user identifier
     * @return active sessions
     */
    Uni<List<Session>> getUserSessions(String userId);

    /**
     * Ends every active session past its expiration.
     *
     * @return number of sessions ended by this sweep
     */
    Uni<Integer> cleanupExpiredSessions();

    /**
     * Exception thrown when session creation fails.
     */
    class SessionCreationException extends RuntimeException {
        public SessionCreationException(String message) {
            super(message);
        }

        public SessionCreationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
