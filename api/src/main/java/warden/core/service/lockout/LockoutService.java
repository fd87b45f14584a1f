package warden.core.service.lockout;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.LockoutConfig;
import warden.core.model.audit.SecurityEvent;
import warden.core.model.audit.SecurityEventType;
import warden.core.model.audit.Severity;
import warden.core.model.common.ClientMetadata;
import warden.core.model.lockout.FailedAttemptResult;
import warden.core.model.lockout.LockoutRecord;
import warden.core.model.lockout.LockoutStats;
import warden.core.model.lockout.LockoutStatus;
import warden.core.model.lockout.LockoutType;
import warden.core.port.in.LockoutManagement;
import warden.core.port.out.LockoutRepository;
import warden.core.service.audit.SecurityEventLog;
import warden.core.util.Redaction;

/**
 * Progressive lockout on repeated authentication failures.
 *
 * <p>Failed attempts are counted per (identifier, type). The count maps to an
 * escalation level, and every level from 1 up locks the identifier for a configured
 * duration that grows with the level:
 * <ul>
 *   <li>3-4 attempts: level 1</li>
 *   <li>5-9 attempts: level 2</li>
 *   <li>10-14 attempts: level 3</li>
 *   <li>15 or more attempts: level 4</li>
 * </ul>
 *
 * <p>The counter only goes back to zero through {@link #clearLockout}; callers must
 * clear it after every successful authentication.
 */
@ApplicationScoped
public class LockoutService implements LockoutManagement {

    private static final Logger LOG = Logger.getLogger(LockoutService.class);

    static final int MAX_LEVEL = 4;

    private final LockoutRepository repository;
    private final SecurityEventLog eventLog;
    private final Clock clock;
    private final List<Duration> durations;

    @Inject
    public LockoutService(LockoutRepository repository, SecurityEventLog eventLog, LockoutConfig config, Clock clock) {
        this.repository = repository;
        this.eventLog = eventLog;
        this.clock = clock;
        this.durations = List.of(
                config.levelOneDuration(),
                config.levelTwoDuration(),
                config.levelThreeDuration(),
                config.levelFourDuration());
        validateDurations(durations);
    }

    private static void validateDurations(List<Duration> durations) {
        for (int i = 0; i < durations.size(); i++) {
            Duration current = durations.get(i);
            if (current == null || current.isNegative() || current.isZero()) {
                throw new IllegalStateException("Lockout duration for level " + (i + 1) + " must be positive");
            }
            if (i > 0 && current.compareTo(durations.get(i - 1)) < 0) {
                throw new IllegalStateException("Lockout duration for level " + (i + 1)
                        + " must not be shorter than level " + i + ": " + current + " < " + durations.get(i - 1));
            }
        }
    }

    @Override
    public Uni<FailedAttemptResult> recordFailedAttempt(String identifier, LockoutType type, ClientMetadata client) {
        requireIdentifier(identifier, type);
        ClientMetadata metadata = client != null ? client : ClientMetadata.unknown();
        Instant now = clock.instant();

        return repository
                .recordFailure(identifier, type, now, this::calculateLockoutLevel, this::lockoutDuration)
                .flatMap(record -> {
                    int attempts = record.failedAttempts();
                    int level = calculateLockoutLevel(attempts);

                    LOG.debugf(
                            "Recorded failed attempt for %s %s: attempts=%d, level=%d",
                            type.value(), Redaction.identifier(identifier), attempts, level);

                    Uni<SecurityEvent> failed = eventLog.record(
                            event(SecurityEventType.LOGIN_FAILED, Severity.INFO, record)
                                    .client(metadata)
                                    .description("Authentication failed")
                                    .metadata("failedAttempts", attempts)
                                    .createdAt(now)
                                    .build());

                    if (level == 0) {
                        return failed.replaceWith(new FailedAttemptResult(attempts, false, 0, null));
                    }

                    LOG.infof(
                            "Locked %s %s at level %d until %s (%d failed attempts)",
                            type.value(), Redaction.identifier(identifier), level, record.lockedUntil(), attempts);
                    return failed.chain(() -> eventLog.record(
                                    event(SecurityEventType.ACCOUNT_LOCKED, severityFor(level), record)
                                            .client(metadata)
                                            .description("Locked after " + attempts + " failed attempts")
                                            .metadata("failedAttempts", attempts)
                                            .metadata("lockLevel", level)
                                            .metadata("lockedUntil", record.lockedUntil().toString())
                                            .createdAt(now)
                                            .build()))
                            .replaceWith(new FailedAttemptResult(
                                    attempts, record.isLockedAt(now), level, record.lockedUntil()));
                });
    }

    @Override
    public int calculateLockoutLevel(int attempts) {
        if (attempts >= 15) {
            return 4;
        }
        if (attempts >= 10) {
            return 3;
        }
        if (attempts >= 5) {
            return 2;
        }
        if (attempts >= 3) {
            return 1;
        }
        return 0;
    }

    @Override
    public Duration lockoutDuration(int level) {
        if (level < 1 || level > MAX_LEVEL) {
            throw new IllegalArgumentException("Lockout level must be between 1 and " + MAX_LEVEL + ": " + level);
        }
        return durations.get(level - 1);
    }

    @Override
    public Uni<LockoutStatus> checkLockout(String identifier, LockoutType type) {
        requireIdentifier(identifier, type);
        Instant now = clock.instant();
        return repository.find(identifier, type).map(found -> found.map(record -> new LockoutStatus(
                        record.isLockedAt(now), record.lockedUntil(), record.failedAttempts()))
                .orElseGet(LockoutStatus::unlocked));
    }

    @Override
    public Uni<Boolean> clearLockout(String identifier, LockoutType type) {
        return clearLockout(identifier, type, false);
    }

    @Override
    public Uni<Boolean> clearLockout(String identifier, LockoutType type, boolean manual) {
        requireIdentifier(identifier, type);

        return repository.reset(identifier, type, manual).flatMap(reset -> {
            if (reset.isEmpty()) {
                return Uni.createFrom().item(false);
            }
            if (!manual) {
                LOG.debugf("Cleared failed attempts for %s %s", type.value(), Redaction.identifier(identifier));
                return Uni.createFrom().item(true);
            }
            LOG.infof("Manually unlocked %s %s", type.value(), Redaction.identifier(identifier));
            return eventLog.record(event(SecurityEventType.ACCOUNT_UNLOCKED, Severity.INFO, reset.get())
                            .description("Lockout cleared manually")
                            .metadata("unlockAttempts", reset.get().unlockAttempts())
                            .createdAt(clock.instant())
                            .build())
                    .replaceWith(true);
        });
    }

    @Override
    public Uni<LockoutStats> getLockoutStats(Duration window) {
        Objects.requireNonNull(window, "window");
        Instant now = clock.instant();
        Instant since = now.minus(window);

        return repository
                .streamAll()
                .filter(record -> record.lastLockedAt() != null && !record.lastLockedAt().isBefore(since))
                .collect()
                .asList()
                .map(records -> {
                    Map<Integer, Integer> byLevel = new LinkedHashMap<>();
                    for (int level = 1; level <= MAX_LEVEL; level++) {
                        byLevel.put(level, 0);
                    }
                    Map<LockoutType, Integer> byType = new EnumMap<>(LockoutType.class);
                    for (LockoutType type : LockoutType.values()) {
                        byType.put(type, 0);
                    }

                    int active = 0;
                    for (LockoutRecord record : records) {
                        byLevel.merge(record.lockLevel(), 1, Integer::sum);
                        byType.merge(record.type(), 1, Integer::sum);
                        if (record.isLockedAt(now)) {
                            active++;
                        }
                    }
                    return new LockoutStats(window, records.size(), active, byLevel, byType);
                });
    }

    @Override
    public Multi<LockoutRecord> streamLockouts() {
        Instant now = clock.instant();
        return repository.streamAll().filter(record -> record.isLockedAt(now));
    }

    static Severity severityFor(int level) {
        if (level >= MAX_LEVEL) {
            return Severity.CRITICAL;
        }
        return level >= 2 ? Severity.WARNING : Severity.INFO;
    }

    private static SecurityEvent.Builder event(SecurityEventType type, Severity severity, LockoutRecord record) {
        return SecurityEvent.builder(type, severity)
                .metadata("identifier", record.identifier())
                .metadata("lockoutType", record.type().value());
    }

    private static void requireIdentifier(String identifier, LockoutType type) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier must not be blank");
        }
        Objects.requireNonNull(type, "type");
    }
}
