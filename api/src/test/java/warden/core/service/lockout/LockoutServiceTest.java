package warden.core.service.lockout;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.IntFunction;
import java.util.function.IntUnaryOperator;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.storage.memory.InMemoryLockoutRepository;
import warden.adapter.out.storage.memory.InMemorySecurityEventRepository;
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
import warden.core.port.out.LockoutRepository;
import warden.core.service.audit.SecurityEventLog;
import warden.testing.Concurrently;
import warden.testing.MutableClock;
import warden.testing.RecordingPublisher;
import warden.testing.TestConfigs;

@DisplayName("LockoutService")
class LockoutServiceTest {

    private static final String EMAIL = "alice@example.com";
    private static final ClientMetadata CLIENT = ClientMetadata.of("198.51.100.7", "Mozilla/5.0 (X11)");

    private LockoutConfig config;
    private MutableClock clock;
    private RecordingPublisher publisher;
    private LockoutService service;

    @BeforeEach
    void setUp() {
        config = TestConfigs.lockout();
        clock = MutableClock.startingAt("2024-03-01T09:00:00Z");
        publisher = new RecordingPublisher();
        service = newService();
    }

    private LockoutService newService() {
        var eventLog = new SecurityEventLog(new InMemorySecurityEventRepository(), publisher);
        return new LockoutService(new InMemoryLockoutRepository(), eventLog, config, clock);
    }

    private FailedAttemptResult fail(String identifier, LockoutType type) {
        return service.recordFailedAttempt(identifier, type, CLIENT).await().indefinitely();
    }

    private FailedAttemptResult failTimes(int times) {
        FailedAttemptResult last = null;
        for (int i = 0; i < times; i++) {
            last = fail(EMAIL, LockoutType.EMAIL);
        }
        return last;
    }

    @Nested
    @DisplayName("calculateLockoutLevel()")
    class LevelTests {

        @Test
        @DisplayName("should map thresholds to levels")
        void shouldMapThresholds() {
            assertEquals(0, service.calculateLockoutLevel(0));
            assertEquals(0, service.calculateLockoutLevel(2));
            assertEquals(1, service.calculateLockoutLevel(3));
            assertEquals(1, service.calculateLockoutLevel(4));
            assertEquals(2, service.calculateLockoutLevel(5));
            assertEquals(2, service.calculateLockoutLevel(9));
            assertEquals(3, service.calculateLockoutLevel(10));
            assertEquals(3, service.calculateLockoutLevel(14));
            assertEquals(4, service.calculateLockoutLevel(15));
            assertEquals(4, service.calculateLockoutLevel(1_000));
        }

        @Test
        @DisplayName("should never decrease as attempts grow")
        void shouldBeNonDecreasing() {
            int previous = 0;
            for (int attempts = 0; attempts <= 100; attempts++) {
                int level = service.calculateLockoutLevel(attempts);
                assertTrue(level >= previous, "level dropped at " + attempts);
                previous = level;
            }
        }

        @Test
        @DisplayName("should resolve configured durations by level")
        void shouldResolveDurations() {
            assertEquals(Duration.ofMinutes(1), service.lockoutDuration(1));
            assertEquals(Duration.ofMinutes(15), service.lockoutDuration(2));
            assertEquals(Duration.ofHours(1), service.lockoutDuration(3));
            assertEquals(Duration.ofHours(24), service.lockoutDuration(4));
            assertThrows(IllegalArgumentException.class, () -> service.lockoutDuration(0));
            assertThrows(IllegalArgumentException.class, () -> service.lockoutDuration(5));
        }
    }

    @Nested
    @DisplayName("Configuration validation")
    class ConfigValidationTests {

        @Test
        @DisplayName("should reject non-positive durations")
        void shouldRejectNonPositive() {
            when(config.levelOneDuration()).thenReturn(Duration.ZERO);

            assertThrows(IllegalStateException.class, LockoutServiceTest.this::newService);
        }

        @Test
        @DisplayName("should reject durations that shrink with the level")
        void shouldRejectShrinking() {
            when(config.levelThreeDuration()).thenReturn(Duration.ofMinutes(5));

            assertThrows(IllegalStateException.class, LockoutServiceTest.this::newService);
        }
    }

    @Nested
    @DisplayName("recordFailedAttempt()")
    class RecordFailedAttemptTests {

        @Test
        @DisplayName("should not lock below three attempts")
        void shouldNotLockBelowThreshold() {
            FailedAttemptResult result = failTimes(2);

            assertEquals(2, result.attempts());
            assertFalse(result.locked());
            assertEquals(0, result.lockLevel());
            assertNull(result.lockedUntil());
            assertEquals(2, publisher.ofType(SecurityEventType.LOGIN_FAILED).size());
            assertTrue(publisher.ofType(SecurityEventType.ACCOUNT_LOCKED).isEmpty());
        }

        @Test
        @DisplayName("should lock at level one on the third attempt")
        void shouldLockAtLevelOne() {
            FailedAttemptResult result = failTimes(3);

            assertTrue(result.locked());
            assertEquals(1, result.lockLevel());
            assertEquals(clock.instant().plus(Duration.ofMinutes(1)), result.lockedUntil());

            List<SecurityEvent> locked = publisher.ofType(SecurityEventType.ACCOUNT_LOCKED);
            assertEquals(1, locked.size());
            assertEquals(Severity.INFO, locked.get(0).severity());
            assertEquals(1, locked.get(0).metadata().get("lockLevel"));
            assertEquals("198.51.100.7", locked.get(0).ipAddress());
        }

        @Test
        @DisplayName("should escalate to level two and extend the lock")
        void shouldEscalate() {
            failTimes(4);
            clock.advance(Duration.ofSeconds(10));

            FailedAttemptResult result = fail(EMAIL, LockoutType.EMAIL);

            assertEquals(5, result.attempts());
            assertEquals(2, result.lockLevel());
            assertEquals(clock.instant().plus(Duration.ofMinutes(15)), result.lockedUntil());
            assertEquals(
                    Severity.WARNING,
                    publisher.ofType(SecurityEventType.ACCOUNT_LOCKED).get(2).severity());
        }

        @Test
        @DisplayName("should record level four as critical")
        void shouldRecordLevelFourAsCritical() {
            FailedAttemptResult result = failTimes(15);

            assertEquals(4, result.lockLevel());
            List<SecurityEvent> locked = publisher.ofType(SecurityEventType.ACCOUNT_LOCKED);
            assertEquals(Severity.CRITICAL, locked.get(locked.size() - 1).severity());
        }

        @Test
        @DisplayName("should track email and IP identifiers independently")
        void shouldTrackTypesIndependently() {
            failTimes(3);

            FailedAttemptResult ip = fail("198.51.100.7", LockoutType.IP);

            assertEquals(1, ip.attempts());
            assertFalse(ip.locked());
            assertFalse(service.checkLockout(EMAIL, LockoutType.IP).await().indefinitely().locked());
        }

        @Test
        @DisplayName("should keep the counter past lock expiry")
        void shouldKeepCounterPastExpiry() {
            failTimes(3);
            clock.advance(Duration.ofMinutes(2));

            FailedAttemptResult result = fail(EMAIL, LockoutType.EMAIL);

            assertEquals(4, result.attempts());
            assertTrue(result.locked());
            assertEquals(1, result.lockLevel());
        }

        @Test
        @DisplayName("should not lose increments under concurrency")
        void shouldCountConcurrentFailures() throws Exception {
            List<Callable<FailedAttemptResult>> attempts = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                attempts.add(() -> fail(EMAIL, LockoutType.EMAIL));
            }
            Concurrently.invokeAll(attempts);

            LockoutStatus status = service.checkLockout(EMAIL, LockoutType.EMAIL).await().indefinitely();
            assertEquals(50, status.failedAttempts());
            assertTrue(status.locked());
            assertEquals(clock.instant().plus(Duration.ofHours(24)), status.lockedUntil());
        }

        @Test
        @DisplayName("should not lock a record cleared right after a failure was counted")
        void shouldNotLockAfterInterleavedClear() {
            var store = new InMemoryLockoutRepository();
            var clearing = new ClearAfterFailureRepository(store);
            var eventLog = new SecurityEventLog(new InMemorySecurityEventRepository(), publisher);
            service = new LockoutService(clearing, eventLog, config, clock);

            for (int i = 0; i < 3; i++) {
                fail(EMAIL, LockoutType.EMAIL);
            }

            LockoutStatus status = service.checkLockout(EMAIL, LockoutType.EMAIL).await().indefinitely();
            assertEquals(0, status.failedAttempts());
            assertFalse(status.locked());
            assertNull(status.lockedUntil());
        }

        @Test
        @DisplayName("should keep lock and counter consistent under concurrent clears")
        void shouldStayConsistentWithConcurrentClears() throws Exception {
            List<Callable<Object>> calls = new ArrayList<>();
            for (int i = 0; i < 60; i++) {
                if (i % 4 == 3) {
                    calls.add(() -> service.clearLockout(EMAIL, LockoutType.EMAIL).await().indefinitely());
                } else {
                    calls.add(() -> fail(EMAIL, LockoutType.EMAIL));
                }
            }
            Concurrently.invokeAll(calls);

            LockoutStatus status = service.checkLockout(EMAIL, LockoutType.EMAIL).await().indefinitely();
            if (status.lockedUntil() != null) {
                assertTrue(service.calculateLockoutLevel(status.failedAttempts()) >= 1);
            } else {
                assertEquals(0, service.calculateLockoutLevel(status.failedAttempts()));
            }
        }

        @Test
        @DisplayName("should reject blank identifiers")
        void shouldRejectBlankIdentifier() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> service.recordFailedAttempt(" ", LockoutType.EMAIL, CLIENT));
        }
    }

    @Nested
    @DisplayName("checkLockout()")
    class CheckLockoutTests {

        @Test
        @DisplayName("should report unknown identifiers as unlocked")
        void shouldReportUnknownAsUnlocked() {
            LockoutStatus status = service.checkLockout(EMAIL, LockoutType.EMAIL).await().indefinitely();

            assertFalse(status.locked());
            assertEquals(0, status.failedAttempts());
        }

        @Test
        @DisplayName("should unlock when the lock expires")
        void shouldUnlockAfterExpiry() {
            failTimes(3);
            assertTrue(service.checkLockout(EMAIL, LockoutType.EMAIL).await().indefinitely().locked());

            clock.advance(Duration.ofMinutes(1).plusSeconds(1));

            LockoutStatus status = service.checkLockout(EMAIL, LockoutType.EMAIL).await().indefinitely();
            assertFalse(status.locked());
            assertEquals(3, status.failedAttempts());
        }
    }

    @Nested
    @DisplayName("clearLockout()")
    class ClearLockoutTests {

        @Test
        @DisplayName("should reset ten failed attempts so the identifier is unlocked")
        void shouldResetLock() {
            failTimes(10);

            assertTrue(service.clearLockout(EMAIL, LockoutType.EMAIL).await().indefinitely());

            LockoutStatus status = service.checkLockout(EMAIL, LockoutType.EMAIL).await().indefinitely();
            assertFalse(status.locked());
            assertEquals(0, status.failedAttempts());
            assertTrue(publisher.ofType(SecurityEventType.ACCOUNT_UNLOCKED).isEmpty());
        }

        @Test
        @DisplayName("should restart escalation from zero after reset")
        void shouldRestartEscalation() {
            failTimes(10);
            service.clearLockout(EMAIL, LockoutType.EMAIL).await().indefinitely();

            FailedAttemptResult result = fail(EMAIL, LockoutType.EMAIL);

            assertEquals(1, result.attempts());
            assertFalse(result.locked());
        }

        @Test
        @DisplayName("should record manual unlocks")
        void shouldRecordManualUnlock() {
            failTimes(5);

            service.clearLockout(EMAIL, LockoutType.EMAIL, true).await().indefinitely();

            List<SecurityEvent> unlocked = publisher.ofType(SecurityEventType.ACCOUNT_UNLOCKED);
            assertEquals(1, unlocked.size());
            assertEquals(1, unlocked.get(0).metadata().get("unlockAttempts"));
        }

        @Test
        @DisplayName("should return false when nothing is tracked")
        void shouldReturnFalseWhenUnknown() {
            assertFalse(service.clearLockout(EMAIL, LockoutType.EMAIL).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("getLockoutStats()")
    class StatsTests {

        @Test
        @DisplayName("should count lockouts in the window by level and type")
        void shouldCountLockouts() {
            failTimes(5);
            for (int i = 0; i < 3; i++) {
                fail("198.51.100.7", LockoutType.IP);
            }
            fail("bob@example.com", LockoutType.EMAIL);

            LockoutStats stats = service.getLockoutStats(Duration.ofHours(1)).await().indefinitely();

            assertEquals(2, stats.totalLockouts());
            assertEquals(2, stats.activeLockouts());
            assertEquals(1, stats.lockoutsByLevel().get(1));
            assertEquals(1, stats.lockoutsByLevel().get(2));
            assertEquals(0, stats.lockoutsByLevel().get(4));
            assertEquals(1, stats.lockoutsByType().get(LockoutType.EMAIL));
            assertEquals(1, stats.lockoutsByType().get(LockoutType.IP));
        }

        @Test
        @DisplayName("should exclude lockouts older than the window")
        void shouldExcludeOldLockouts() {
            failTimes(3);
            clock.advance(Duration.ofHours(2));

            LockoutStats stats = service.getLockoutStats(Duration.ofHours(1)).await().indefinitely();

            assertEquals(0, stats.totalLockouts());
            assertEquals(0, stats.activeLockouts());
        }

        @Test
        @DisplayName("should keep cleared lockouts in the stats but not as active")
        void shouldKeepClearedLockouts() {
            failTimes(3);
            service.clearLockout(EMAIL, LockoutType.EMAIL).await().indefinitely();

            LockoutStats stats = service.getLockoutStats(Duration.ofHours(1)).await().indefinitely();

            assertEquals(1, stats.totalLockouts());
            assertEquals(0, stats.activeLockouts());
        }
    }

    @Nested
    @DisplayName("streamLockouts()")
    class StreamTests {

        @Test
        @DisplayName("should stream only currently locked records")
        void shouldStreamLocked() {
            failTimes(3);
            fail("bob@example.com", LockoutType.EMAIL);

            List<LockoutRecord> locked = service.streamLockouts().collect().asList().await().indefinitely();

            assertEquals(1, locked.size());
            assertEquals(EMAIL, locked.get(0).identifier());
            Instant until = locked.get(0).lockedUntil();
            assertEquals(clock.instant().plus(Duration.ofMinutes(1)), until);
        }
    }

    @Test
    @DisplayName("should grade severity by level")
    void shouldGradeSeverity() {
        assertEquals(Severity.INFO, LockoutService.severityFor(1));
        assertEquals(Severity.WARNING, LockoutService.severityFor(2));
        assertEquals(Severity.WARNING, LockoutService.severityFor(3));
        assertEquals(Severity.CRITICAL, LockoutService.severityFor(4));
    }

    /**
     * Store whose every counted failure is immediately followed by a successful login.
     */
    private static final class ClearAfterFailureRepository implements LockoutRepository {

        private final LockoutRepository delegate;

        ClearAfterFailureRepository(LockoutRepository delegate) {
            this.delegate = delegate;
        }

        @Override
        public Uni<LockoutRecord> recordFailure(
                String identifier,
                LockoutType type,
                Instant now,
                IntUnaryOperator levelFor,
                IntFunction<Duration> durationFor) {
            return delegate.recordFailure(identifier, type, now, levelFor, durationFor)
                    .call(record -> delegate.reset(identifier, type, false));
        }

        @Override
        public Uni<Optional<LockoutRecord>> find(String identifier, LockoutType type) {
            return delegate.find(identifier, type);
        }

        @Override
        public Uni<Optional<LockoutRecord>> reset(String identifier, LockoutType type, boolean manual) {
            return delegate.reset(identifier, type, manual);
        }

        @Override
        public Multi<LockoutRecord> streamAll() {
            return delegate.streamAll();
        }
    }
}
