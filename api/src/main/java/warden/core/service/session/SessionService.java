package warden.core.service.session;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.SessionConfig;
import warden.core.model.audit.SecurityEvent;
import warden.core.model.audit.SecurityEventType;
import warden.core.model.audit.Severity;
import warden.core.model.common.ClientMetadata;
import warden.core.model.session.Session;
import warden.core.model.session.SessionEndReason;
import warden.core.model.session.SessionInsertion;
import warden.core.model.session.SessionValidationResult;
import warden.core.port.in.SessionManagement;
import warden.core.port.out.SessionRepository;
import warden.core.service.audit.SecurityEventLog;
import warden.core.util.Redaction;

/**
 * Implementation of session management operations.
 *
 * <p>Handles session lifecycle including creation under the per-user cap with collision
 * retry, validation with sliding expiration and suspicious-activity detection, and
 * invalidation. Every lifecycle transition is written to the security audit log.
 */
@ApplicationScoped
public class SessionService implements SessionManagement {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    private final SessionRepository repository;
    private final SessionIdGenerator idGenerator;
    private final SuspiciousActivityDetector detector;
    private final SecurityEventLog eventLog;
    private final SessionConfig config;
    private final Clock clock;

    @Inject
    public SessionService(
            SessionRepository repository,
            SessionIdGenerator idGenerator,
            SuspiciousActivityDetector detector,
            SecurityEventLog eventLog,
            SessionConfig config,
            Clock clock) {
        this.repository = repository;
        this.idGenerator = idGenerator;
        this.detector = detector;
        this.eventLog = eventLog;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<Session> createSession(String userId, ClientMetadata client) {
        requireNonBlank(userId, "userId");
        ClientMetadata metadata = client != null ? client : ClientMetadata.unknown();

        Instant now = clock.instant();
        Instant idleExpiry = now.plus(config.defaultTimeout());
        Instant absoluteExpiry = now.plus(config.maxAbsoluteLifetime());
        Instant expiresAt = idleExpiry.isBefore(absoluteExpiry) ? idleExpiry : absoluteExpiry;

        Session session = Session.create(
                idGenerator.generate(),
                userId,
                now,
                expiresAt,
                metadata.ipAddress(),
                metadata.userAgent(),
                metadata.mobile());

        return createSessionWithRetry(session, now, 0)
                .call(insertion -> recordEvictions(insertion.evicted(), metadata))
                .call(insertion -> eventLog.record(
                        event(SecurityEventType.SESSION_CREATED, Severity.INFO, insertion.created(), metadata)
                                .description("Session created")
                                .metadata("mobile", metadata.mobile())
                                .build()))
                .map(SessionInsertion::created);
    }

    private Uni<SessionInsertion> createSessionWithRetry(Session session, Instant now, int attempt) {
        int maxRetries = config.idGeneration().maxRetries();

        if (attempt >= maxRetries) {
            return Uni.createFrom()
                    .failure(new SessionCreationException(
                            "Failed to generate unique session ID after " + maxRetries + " attempts"));
        }

        return repository
                .insertWithinLimit(session, config.maxSessionsPerUser(), now)
                .flatMap(inserted -> {
                    if (inserted.isPresent()) {
                        LOG.infof(
                                "Session created: %s for user %s",
                                Redaction.sessionId(session.id()), session.userId());
                        return Uni.createFrom().item(inserted.get());
                    }

                    // Collision detected, retry with new ID
                    LOG.warnf("Session ID collision detected (attempt %d/%d), retrying", attempt + 1, maxRetries);
                    return createSessionWithRetry(session.withId(idGenerator.generate()), now, attempt + 1);
                });
    }

    private Uni<Void> recordEvictions(List<Session> evicted, ClientMetadata client) {
        if (evicted.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        LOG.infof(
                "Session limit of %d reached for user %s, ended %d oldest session(s)",
                config.maxSessionsPerUser(), evicted.get(0).userId(), evicted.size());
        return recordEach(evicted, session -> event(
                        SecurityEventType.SESSION_LIMIT_EXCEEDED, Severity.WARNING, session, client)
                .description("Session ended: concurrent session limit exceeded")
                .metadata("maxSessionsPerUser", config.maxSessionsPerUser())
                .metadata("sessionCreatedAt", session.createdAt().toString())
                .build());
    }

    @Override
    public Uni<SessionValidationResult> validateAndUpdateSession(String sessionId, ClientMetadata client) {
        if (sessionId == null || sessionId.isBlank()) {
            return Uni.createFrom().item(SessionValidationResult.invalid());
        }
        ClientMetadata metadata = client != null ? client : ClientMetadata.unknown();

        return repository.findById(sessionId).flatMap(found -> {
            if (found.isEmpty() || !found.get().active()) {
                LOG.debugf("Session %s not found or inactive", Redaction.sessionId(sessionId));
                return Uni.createFrom().item(SessionValidationResult.invalid());
            }

            Session session = found.get();
            Instant now = clock.instant();

            if (session.isExpiredAt(now)) {
                return expire(session, now).replaceWith(SessionValidationResult.invalid());
            }

            boolean suspicious = detector.detect(session, metadata.ipAddress(), metadata.userAgent());
            Instant slid = slidExpiry(session, now);

            return repository
                    .updateIfActive(sessionId, current -> {
                        Session refreshed = current.withActivity(now, slid);
                        return suspicious ? refreshed.withSuspiciousActivity(now) : refreshed;
                    })
                    .flatMap(updated -> {
                        if (updated.isEmpty()) {
                            // Ended concurrently
                            return Uni.createFrom().item(SessionValidationResult.invalid());
                        }
                        if (suspicious) {
                            return recordSuspiciousActivity(updated.get(), metadata)
                                    .replaceWith(SessionValidationResult.valid(updated.get(), true));
                        }
                        return Uni.createFrom().item(SessionValidationResult.valid(updated.get(), false));
                    });
        });
    }

    private Instant slidExpiry(Session session, Instant now) {
        Instant idleExpiry = now.plus(config.defaultTimeout());
        Instant absoluteExpiry = session.absoluteExpiry(config.maxAbsoluteLifetime());
        return idleExpiry.isBefore(absoluteExpiry) ? idleExpiry : absoluteExpiry;
    }

    private Uni<Void> expire(Session session, Instant now) {
        return repository.end(session.id(), SessionEndReason.EXPIRED, now).flatMap(ended -> {
            if (ended.isEmpty()) {
                return Uni.createFrom().voidItem();
            }
            LOG.debugf("Session %s expired on validation", Redaction.sessionId(session.id()));
            return eventLog.record(invalidatedEvent(ended.get())).replaceWithVoid();
        });
    }

    private Uni<Void> recordSuspiciousActivity(Session session, ClientMetadata client) {
        LOG.warnf(
                "Suspicious activity on session %s for user %s (count=%d)",
                Redaction.sessionId(session.id()), session.userId(), session.suspiciousActivityCount());
        return eventLog.recordQuietly(event(SecurityEventType.SUSPICIOUS_ACTIVITY, Severity.WARNING, session, client)
                .description("Session used from a different client")
                .metadata("originalIpAddress", session.ipAddress())
                .metadata("originalUserAgent", session.userAgent())
                .metadata("suspiciousActivityCount", session.suspiciousActivityCount())
                .build());
    }

    @Override
    public Uni<Optional<Session>> getSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return repository.findById(sessionId);
    }

    @Override
    public Uni<Boolean> invalidateSession(String sessionId, SessionEndReason reason) {
        if (sessionId == null || sessionId.isBlank()) {
            return Uni.createFrom().item(false);
        }
        SessionEndReason endReason = reason != null ? reason : SessionEndReason.MANUAL;

        return repository.end(sessionId, endReason, clock.instant()).flatMap(ended -> {
            if (ended.isEmpty()) {
                LOG.debugf("Session %s already ended or unknown", Redaction.sessionId(sessionId));
                return Uni.createFrom().item(false);
            }
            LOG.infof("Invalidated session %s: %s", Redaction.sessionId(sessionId), endReason.value());
            return eventLog.record(invalidatedEvent(ended.get())).replaceWith(true);
        });
    }

    @Override
    public Uni<Integer> invalidateAllUserSessions(String userId, SessionEndReason reason) {
        requireNonBlank(userId, "userId");
        SessionEndReason endReason = reason != null ? reason : SessionEndReason.MANUAL;

        return repository.endAllForUser(userId, endReason, clock.instant()).flatMap(ended -> {
            LOG.infof("Invalidated %d session(s) for user %s: %s", ended.size(), userId, endReason.value());
            return recordEach(ended, this::invalidatedEvent).replaceWith(ended.size());
        });
    }

    @Override
    public Uni<List<Session>> getUserSessions(String userId) {
        requireNonBlank(userId, "userId");
        return repository.findActiveByUserId(userId).map(sessions -> sessions.stream()
                .sorted(Comparator.comparing(Session::lastActivityAt).reversed())
                .toList());
    }

    @Override
    public Uni<Integer> cleanupExpiredSessions() {
        Instant now = clock.instant();
        return repository.endExpired(now).flatMap(expired -> {
            if (expired.isEmpty()) {
                return Uni.createFrom().item(0);
            }
            LOG.infof("Expired %d session(s)", expired.size());
            return eventLog.record(SecurityEvent.builder(SecurityEventType.SESSIONS_EXPIRED, Severity.INFO)
                            .description("Expired sessions cleaned up")
                            .metadata("count", expired.size())
                            .createdAt(now)
                            .build())
                    .replaceWith(expired.size());
        });
    }

    private SecurityEvent invalidatedEvent(Session session) {
        SessionEndReason reason = session.endReason();
        Severity severity = reason == SessionEndReason.SUSPICIOUS_ACTIVITY || reason == SessionEndReason.SECURITY
                ? Severity.WARNING
                : Severity.INFO;
        return SecurityEvent.builder(SecurityEventType.SESSION_INVALIDATED, severity)
                .userId(session.userId())
                .sessionId(session.id())
                .ipAddress(session.ipAddress())
                .userAgent(session.userAgent())
                .description("Session ended: " + reason.value())
                .metadata("reason", reason.value())
                .createdAt(session.endedAt())
                .build();
    }

    private Uni<Void> recordEach(List<Session> sessions, Function<Session, SecurityEvent> mapper) {
        return Multi.createFrom()
                .iterable(sessions)
                .onItem()
                .transformToUniAndConcatenate(session -> eventLog.record(mapper.apply(session)))
                .collect()
                .asList()
                .replaceWithVoid();
    }

    private SecurityEvent.Builder event(
            SecurityEventType type, Severity severity, Session session, ClientMetadata client) {
        return SecurityEvent.builder(type, severity)
                .userId(session.userId())
                .sessionId(session.id())
                .client(client)
                .createdAt(clock.instant());
    }

    private static void requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
