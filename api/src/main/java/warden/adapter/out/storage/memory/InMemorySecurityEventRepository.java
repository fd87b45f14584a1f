package warden.adapter.out.storage.memory;

import java.util.List;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

import io.smallrye.mutiny.Uni;

import warden.core.model.audit.SecurityEvent;
import warden.core.model.audit.SecurityEventQuery;
import warden.core.port.out.SecurityEventRepository;

/**
 * In-memory implementation of SecurityEventRepository.
 *
 * <p>This implementation is intended for development and testing only.
 * Events are kept in sequence order for the life of the process.
 */
public class InMemorySecurityEventRepository implements SecurityEventRepository {

    private final AtomicLong sequence = new AtomicLong();
    private final ConcurrentNavigableMap<Long, SecurityEvent> events = new ConcurrentSkipListMap<>();

    @Override
    public Uni<SecurityEvent> append(SecurityEvent event) {
        return Uni.createFrom().item(() -> {
            long next = sequence.incrementAndGet();
            SecurityEvent stored = event.withSequence(next);
            events.put(next, stored);
            return stored;
        });
    }

    @Override
    public Uni<List<SecurityEvent>> query(SecurityEventQuery query) {
        return Uni.createFrom().item(() -> events.descendingMap().values().stream()
                .filter(query::matches)
                .limit(query.limit())
                .toList());
    }

    /**
     * Get the number of stored events (for health and testing).
     */
    public int getEventCount() {
        return events.size();
    }
}
