package warden.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.Session;
import warden.core.model.session.SessionEndReason;
import warden.core.model.session.SessionInsertion;

/**
 * Outbound port for session storage operations.
 *
 * <p>Every mutating operation is atomic per row. Sessions are never deleted; ending a
 * session keeps the row with its end time and reason.
 *
 * <p>Implementation notes:
 * <ul>
 *   <li>In-Memory: {@code ConcurrentHashMap.compute*} plus a per-user lock for inserts</li>
 *   <li>Relational: unique key on id, indexes on (userId, active) and (active, expiresAt),
 *       {@code SELECT ... FOR UPDATE} on the user's active rows for inserts</li>
 * </ul>
 */
public interface SessionRepository {

    /**
     * Insert a new session while enforcing the per-user cap.
     *
     * <p>Serialized per user: counting the user's active sessions, ending the oldest ones
     * (by {@code createdAt}) with {@link SessionEndReason#SESSION_LIMIT_EXCEEDED} until the
     * new session fits, and inserting happen as one step. Two concurrent inserts for the
     * same user can never jointly exceed {@code maxActive}.
     *
     * @param session   session to insert
     * @param maxActive maximum active sessions the user may hold after the insert
     * @param now       time recorded on evicted sessions
     * @return the insertion with evicted sessions, or empty if the session ID already exists
     */
    Uni<Optional<SessionInsertion>> insertWithinLimit(Session session, int maxActive, Instant now);

    /**
     * Retrieve a session by ID, active or ended.
     *
     * @param sessionId session identifier
     * @return the session, or empty if not found
     */
    Uni<Optional<Session>> findById(String sessionId);

    /**
     * Atomically update a session if it is still active.
     *
     * @param sessionId session identifier
     * @param update    transformation applied to the current row
     * @return the updated session, or empty if not found or no longer active
     */
    Uni<Optional<Session>> updateIfActive(String sessionId, UnaryOperator<Session> update);

    /**
     * End a session if it is still active.
     *
     * @param sessionId session identifier
     * @param reason    end reason
     * @param now       end time
     * @return the ended session, or empty if not found or already ended
     */
    Uni<Optional<Session>> end(String sessionId, SessionEndReason reason, Instant now);

    /**
     * End every active session of a user.
     *
     * @return the sessions ended by this call
     */
    Uni<List<Session>> endAllForUser(String userId, SessionEndReason reason, Instant now);

    /**
     * End every active session whose {@code expiresAt} is before {@code now}, with
     * {@link SessionEndReason#EXPIRED}.
     *
     * <p>Each row is ended by exactly one caller when sweeps run concurrently.
     *
     * @return the sessions ended by this call
     */
    Uni<List<Session>> endExpired(Instant now);

    /**
     * Find the active sessions of a user.
     *
     * @param userId user identifier
     * @return active sessions, in no particular order
     */
    Uni<List<Session>> findActiveByUserId(String userId);
}
