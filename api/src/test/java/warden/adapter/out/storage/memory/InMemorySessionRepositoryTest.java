package warden.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.session.Session;
import warden.core.model.session.SessionEndReason;
import warden.core.model.session.SessionInsertion;
import warden.testing.Concurrently;

@DisplayName("InMemorySessionRepository")
class InMemorySessionRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");

    private InMemorySessionRepository repository;
    private int nextId;

    @BeforeEach
    void setUp() {
        repository = new InMemorySessionRepository();
    }

    private Session session(String userId, Instant createdAt, Duration ttl) {
        String id = String.format("%064x", ++nextId);
        return Session.create(id, userId, createdAt, createdAt.plus(ttl), "10.0.0.1", "test-agent", false);
    }

    private Optional<SessionInsertion> insert(Session session, int max) {
        return repository.insertWithinLimit(session, max, NOW).await().indefinitely();
    }

    @Nested
    @DisplayName("insertWithinLimit()")
    class InsertTests {

        @Test
        @DisplayName("should report an id collision as empty")
        void shouldReportCollision() {
            Session first = session("user-1", NOW, Duration.ofHours(1));
            insert(first, 5);

            Optional<SessionInsertion> second = insert(first.withId(first.id()), 5);

            assertTrue(second.isEmpty());
            assertEquals(1, repository.getSessionCount());
        }

        @Test
        @DisplayName("should evict the oldest sessions by creation time")
        void shouldEvictOldest() {
            Session oldest = session("user-1", NOW.minusSeconds(30), Duration.ofHours(1));
            Session middle = session("user-1", NOW.minusSeconds(20), Duration.ofHours(1));
            Session newest = session("user-1", NOW.minusSeconds(10), Duration.ofHours(1));
            insert(middle, 3);
            insert(oldest, 3);
            insert(newest, 3);

            SessionInsertion insertion = insert(session("user-1", NOW, Duration.ofHours(1)), 2).orElseThrow();

            assertEquals(
                    List.of(oldest.id(), middle.id()),
                    insertion.evicted().stream().map(Session::id).toList());
            insertion.evicted().forEach(s -> {
                assertFalse(s.active());
                assertEquals(SessionEndReason.SESSION_LIMIT_EXCEEDED, s.endReason());
                assertEquals(NOW, s.endedAt());
            });
            assertEquals(2, repository.findActiveByUserId("user-1").await().indefinitely().size());
        }

        @Test
        @DisplayName("should hold the cap under concurrent inserts")
        void shouldHoldCapConcurrently() throws Exception {
            List<Callable<Optional<SessionInsertion>>> inserts = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                Session s = session("user-1", NOW.plusMillis(i), Duration.ofHours(1));
                inserts.add(() -> insert(s, 3));
            }
            for (Optional<SessionInsertion> inserted : Concurrently.invokeAll(inserts)) {
                assertTrue(inserted.isPresent());
            }

            assertEquals(3, repository.findActiveByUserId("user-1").await().indefinitely().size());
            assertEquals(64, repository.getSessionCount());
        }
    }

    @Nested
    @DisplayName("Conditional updates")
    class ConditionalUpdateTests {

        @Test
        @DisplayName("should end an active session once")
        void shouldEndOnce() {
            Session s = session("user-1", NOW, Duration.ofHours(1));
            insert(s, 5);

            assertTrue(repository.end(s.id(), SessionEndReason.MANUAL, NOW).await().indefinitely().isPresent());
            assertTrue(repository.end(s.id(), SessionEndReason.SECURITY, NOW).await().indefinitely().isEmpty());
            assertTrue(repository.end("missing", SessionEndReason.MANUAL, NOW).await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should not update ended sessions")
        void shouldNotUpdateEnded() {
            Session s = session("user-1", NOW, Duration.ofHours(1));
            insert(s, 5);
            repository.end(s.id(), SessionEndReason.MANUAL, NOW).await().indefinitely();

            Optional<Session> updated = repository.updateIfActive(s.id(), current -> current.withActivity(
                            NOW.plusSeconds(5), NOW.plusSeconds(7200)))
                    .await()
                    .indefinitely();

            assertTrue(updated.isEmpty());
        }

        @Test
        @DisplayName("should end only expired active sessions")
        void shouldEndExpired() {
            Session expired = session("user-1", NOW.minusSeconds(7200), Duration.ofHours(1));
            Session live = session("user-1", NOW, Duration.ofHours(1));
            insert(expired, 5);
            insert(live, 5);

            List<Session> ended = repository.endExpired(NOW).await().indefinitely();

            assertEquals(List.of(expired.id()), ended.stream().map(Session::id).toList());
            assertEquals(SessionEndReason.EXPIRED, ended.get(0).endReason());
            assertTrue(repository.endExpired(NOW).await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should end all sessions of one user only")
        void shouldEndAllForUser() {
            insert(session("user-1", NOW, Duration.ofHours(1)), 5);
            insert(session("user-1", NOW, Duration.ofHours(1)), 5);
            insert(session("user-2", NOW, Duration.ofHours(1)), 5);

            List<Session> ended =
                    repository.endAllForUser("user-1", SessionEndReason.SECURITY, NOW).await().indefinitely();

            assertEquals(2, ended.size());
            assertEquals(1, repository.findActiveByUserId("user-2").await().indefinitely().size());
        }
    }

    @Nested
    @DisplayName("User index")
    class UserIndexTests {

        @Test
        @DisplayName("should forget a user once every session has ended")
        void shouldForgetUserWhenAllEnded() {
            Session manual = session("user-1", NOW, Duration.ofHours(1));
            Session expired = session("user-2", NOW.minusSeconds(7200), Duration.ofHours(1));
            insert(manual, 5);
            insert(expired, 5);
            insert(session("user-3", NOW, Duration.ofHours(1)), 5);
            insert(session("user-3", NOW, Duration.ofHours(1)), 5);

            repository.end(manual.id(), SessionEndReason.MANUAL, NOW).await().indefinitely();
            repository.endExpired(NOW).await().indefinitely();
            repository.endAllForUser("user-3", SessionEndReason.SECURITY, NOW).await().indefinitely();

            assertEquals(0, repository.getIndexedUserCount());
            assertEquals(4, repository.getSessionCount());
            assertFalse(repository.findById(manual.id()).await().indefinitely().orElseThrow().active());
        }

        @Test
        @DisplayName("should keep indexing a user who signs in again")
        void shouldReindexAfterAllEnded() {
            Session first = session("user-1", NOW, Duration.ofHours(1));
            insert(first, 5);
            repository.end(first.id(), SessionEndReason.MANUAL, NOW).await().indefinitely();

            Session second = session("user-1", NOW.plusSeconds(1), Duration.ofHours(1));
            insert(second, 5);

            assertEquals(
                    List.of(second.id()),
                    repository.findActiveByUserId("user-1").await().indefinitely().stream()
                            .map(Session::id)
                            .toList());
            assertEquals(1, repository.getIndexedUserCount());
        }

        @Test
        @DisplayName("should stay consistent when sessions end while others are inserted")
        void shouldStayConsistentUnderChurn() throws Exception {
            List<Session> created = new ArrayList<>();
            List<Callable<Object>> tasks = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                Session s = session("user-1", NOW.plusMillis(i), Duration.ofHours(1));
                created.add(s);
                tasks.add(() -> insert(s, 3));
                tasks.add(() -> repository.end(s.id(), SessionEndReason.MANUAL, NOW).await().indefinitely());
            }
            Concurrently.invokeAll(tasks);

            long stillActive = created.stream()
                    .map(s -> repository.findById(s.id()).await().indefinitely())
                    .filter(found -> found.isPresent() && found.get().active())
                    .count();
            assertTrue(stillActive <= 3);
            assertEquals(stillActive, repository.findActiveByUserId("user-1").await().indefinitely().size());
            assertEquals(stillActive > 0 ? 1 : 0, repository.getIndexedUserCount());
        }
    }
}
