package warden.adapter.out.storage.memory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.IntFunction;
import java.util.function.IntUnaryOperator;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.lockout.LockoutRecord;
import warden.core.model.lockout.LockoutType;
import warden.core.port.out.LockoutRepository;
import warden.core.util.Redaction;

/**
 * In-memory implementation of LockoutRepository.
 *
 * <p>This implementation is intended for development and testing only.
 * Records are lost on restart and not shared across instances.
 *
 * <p>Every mutation goes through {@link ConcurrentMap#compute}, so concurrent
 * failures against the same identifier never lose an increment, and a failure's
 * lock is applied in the same row update as its increment.
 */
public class InMemoryLockoutRepository implements LockoutRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryLockoutRepository.class);

    private final ConcurrentMap<LockoutKey, LockoutRecord> records = new ConcurrentHashMap<>();

    @Override
    public Uni<LockoutRecord> recordFailure(
            String identifier,
            LockoutType type,
            Instant now,
            IntUnaryOperator levelFor,
            IntFunction<Duration> durationFor) {
        return Uni.createFrom().item(() -> {
            final var record = records.compute(new LockoutKey(identifier, type), (key, existing) -> {
                final var failed = existing == null
                        ? LockoutRecord.firstFailure(identifier, type, now)
                        : existing.withFailure(now);
                final int level = levelFor.applyAsInt(failed.failedAttempts());
                return level > 0 ? failed.withLock(level, now.plus(durationFor.apply(level)), now) : failed;
            });
            LOG.debugf(
                    "Recorded failed attempt for %s %s: count=%d",
                    type.value(), Redaction.identifier(identifier), record.failedAttempts());
            return record;
        });
    }

    @Override
    public Uni<Optional<LockoutRecord>> find(String identifier, LockoutType type) {
        return Uni.createFrom().item(() -> Optional.ofNullable(records.get(new LockoutKey(identifier, type))));
    }

    @Override
    public Uni<Optional<LockoutRecord>> reset(String identifier, LockoutType type, boolean manual) {
        return Uni.createFrom()
                .item(() -> Optional.ofNullable(records.computeIfPresent(
                        new LockoutKey(identifier, type), (key, existing) -> existing.reset(manual))));
    }

    @Override
    public Multi<LockoutRecord> streamAll() {
        return Multi.createFrom().iterable(records.values());
    }

    /**
     * Get the number of tracked records (for health and testing).
     */
    public int getRecordCount() {
        return records.size();
    }

    private record LockoutKey(String identifier, LockoutType type) {}
}
