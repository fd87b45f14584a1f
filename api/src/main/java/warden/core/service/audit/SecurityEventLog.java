package warden.core.service.audit;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.audit.SecurityEvent;
import warden.core.model.audit.SecurityEventQuery;
import warden.core.port.out.SecurityEventPublisher;
import warden.core.port.out.SecurityEventRepository;

/**
 * Append-only security audit log.
 *
 * <p>Every event is first appended to the event store, then handed to the publisher
 * for asynchronous fan-out to handlers (logging, metrics). A store failure fails the
 * returned {@link Uni}; a publisher failure is logged and never reaches the caller.
 */
@ApplicationScoped
public class SecurityEventLog {

    private static final Logger LOG = Logger.getLogger(SecurityEventLog.class);

    private final SecurityEventRepository repository;
    private final SecurityEventPublisher publisher;

    @Inject
    public SecurityEventLog(SecurityEventRepository repository, SecurityEventPublisher publisher) {
        this.repository = repository;
        this.publisher = publisher;
    }

    /**
     * Append an event to the audit log.
     *
     * @param event event to record
     * @return the stored event with its sequence number
     */
    public Uni<SecurityEvent> record(SecurityEvent event) {
        return repository.append(event).invoke(this::publish);
    }

    /**
     * Append an advisory event. Store failures are logged and swallowed.
     *
     * <p>Used where the audit write must not change the outcome of the operation that
     * triggered it, such as suspicious-activity flags during session validation.
     */
    public Uni<Void> recordQuietly(SecurityEvent event) {
        return record(event)
                .replaceWithVoid()
                .onFailure()
                .recoverWithUni(e -> {
                    LOG.warnf(e, "Failed to record %s security event", event.eventType().value());
                    return Uni.createFrom().voidItem();
                });
    }

    /**
     * Read events for reporting, newest first.
     */
    public Uni<List<SecurityEvent>> findEvents(SecurityEventQuery query) {
        return repository.query(query);
    }

    private void publish(SecurityEvent event) {
        try {
            publisher.publish(event);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to publish security event %d", event.sequence());
        }
    }
}
