package warden.adapter.out.storage.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.session.Session;
import warden.core.model.session.SessionEndReason;
import warden.core.model.session.SessionInsertion;
import warden.core.port.out.SessionRepository;
import warden.core.util.Redaction;

/**
 * In-memory implementation of SessionRepository.
 *
 * <p>This implementation is intended for development and testing only.
 * Sessions are lost on restart and not shared across instances, and ended
 * sessions are kept for the life of the process so lookups can report them.
 *
 * <p>Row updates use {@link ConcurrentMap#computeIfPresent}. The per-user index
 * holds active session ids only: ending a session removes its id, and a user
 * whose last session ends drops out of the index. Inserts run inside
 * {@link ConcurrentMap#compute} on the user's index entry, so the
 * count-evict-insert sequence cannot interleave for the same user.
 */
public class InMemorySessionRepository implements SessionRepository {

    private static final Logger LOG = Logger.getLogger(InMemorySessionRepository.class);

    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> userSessionIndex = new ConcurrentHashMap<>();

    @Override
    public Uni<Optional<SessionInsertion>> insertWithinLimit(Session session, int maxActive, Instant now) {
        return Uni.createFrom().item(() -> {
            AtomicReference<SessionInsertion> inserted = new AtomicReference<>();
            userSessionIndex.compute(session.userId(), (userId, ids) -> {
                if (sessions.putIfAbsent(session.id(), session) != null) {
                    LOG.debugf("Session ID collision detected: %s", Redaction.sessionId(session.id()));
                    return ids;
                }
                Set<String> index = ids != null ? ids : ConcurrentHashMap.newKeySet();
                List<Session> active = activeSessions(index).stream()
                        .sorted(Comparator.comparing(Session::createdAt))
                        .toList();

                int limit = Math.max(1, maxActive);
                List<Session> evicted = new ArrayList<>();
                for (int i = 0; active.size() - evicted.size() >= limit && i < active.size(); i++) {
                    endIfActive(active.get(i).id(), SessionEndReason.SESSION_LIMIT_EXCEEDED, now)
                            .ifPresent(evicted::add);
                }
                // Drop ended ids, evicted ones included
                index.removeIf(id -> !isActive(id));
                index.add(session.id());
                inserted.set(new SessionInsertion(session, evicted));
                return index;
            });
            return Optional.ofNullable(inserted.get());
        });
    }

    @Override
    public Uni<Optional<Session>> findById(String sessionId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(sessions.get(sessionId)));
    }

    @Override
    public Uni<Optional<Session>> updateIfActive(String sessionId, UnaryOperator<Session> update) {
        return Uni.createFrom().item(() -> {
            AtomicReference<Session> updated = new AtomicReference<>();
            sessions.computeIfPresent(sessionId, (id, current) -> {
                if (!current.active()) {
                    return current;
                }
                Session next = update.apply(current);
                updated.set(next);
                return next;
            });
            return Optional.ofNullable(updated.get());
        });
    }

    @Override
    public Uni<Optional<Session>> end(String sessionId, SessionEndReason reason, Instant now) {
        return Uni.createFrom().item(() -> endIfActive(sessionId, reason, now).map(this::unindex));
    }

    @Override
    public Uni<List<Session>> endAllForUser(String userId, SessionEndReason reason, Instant now) {
        return Uni.createFrom().item(() -> {
            List<Session> ended = new ArrayList<>();
            for (String sessionId : List.copyOf(userSessionIndex.getOrDefault(userId, Set.of()))) {
                endIfActive(sessionId, reason, now).map(this::unindex).ifPresent(ended::add);
            }
            return ended;
        });
    }

    @Override
    public Uni<List<Session>> endExpired(Instant now) {
        return Uni.createFrom().item(() -> {
            List<Session> ended = new ArrayList<>();
            for (Session session : sessions.values()) {
                if (session.active() && session.isExpiredAt(now)) {
                    // Re-checked inside the row update so concurrent sweeps end each row once
                    endIfExpired(session.id(), now).map(this::unindex).ifPresent(ended::add);
                }
            }
            if (!ended.isEmpty()) {
                LOG.debugf("Ended %d expired session(s)", ended.size());
            }
            return ended;
        });
    }

    @Override
    public Uni<List<Session>> findActiveByUserId(String userId) {
        return Uni.createFrom().item(() -> activeSessions(userSessionIndex.getOrDefault(userId, Set.of())));
    }

    private List<Session> activeSessions(Set<String> sessionIds) {
        List<Session> active = new ArrayList<>();
        for (String sessionId : sessionIds) {
            Session session = sessions.get(sessionId);
            if (session != null && session.active()) {
                active.add(session);
            }
        }
        return active;
    }

    private boolean isActive(String sessionId) {
        Session session = sessions.get(sessionId);
        return session != null && session.active();
    }

    private Session unindex(Session ended) {
        userSessionIndex.computeIfPresent(ended.userId(), (userId, ids) -> {
            ids.remove(ended.id());
            return ids.isEmpty() ? null : ids;
        });
        return ended;
    }

    private Optional<Session> endIfActive(String sessionId, SessionEndReason reason, Instant now) {
        AtomicReference<Session> ended = new AtomicReference<>();
        sessions.computeIfPresent(sessionId, (id, current) -> {
            if (!current.active()) {
                return current;
            }
            Session next = current.ended(reason, now);
            ended.set(next);
            return next;
        });
        return Optional.ofNullable(ended.get());
    }

    private Optional<Session> endIfExpired(String sessionId, Instant now) {
        AtomicReference<Session> ended = new AtomicReference<>();
        sessions.computeIfPresent(sessionId, (id, current) -> {
            if (!current.active() || !current.isExpiredAt(now)) {
                return current;
            }
            Session next = current.ended(SessionEndReason.EXPIRED, now);
            ended.set(next);
            return next;
        });
        return Optional.ofNullable(ended.get());
    }

    /**
     * Get the number of stored sessions, active or ended (for health and testing).
     */
    public int getSessionCount() {
        return sessions.size();
    }

    /**
     * Get the number of users with at least one indexed session (for testing).
     */
    public int getIndexedUserCount() {
        return userSessionIndex.size();
    }

    /**
     * Clear all sessions (for testing).
     */
    public void clear() {
        sessions.clear();
        userSessionIndex.clear();
    }
}
