package warden.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.audit.SecurityEvent;
import warden.core.model.audit.SecurityEventQuery;

/**
 * Outbound port for the append-only audit store.
 */
public interface SecurityEventRepository {

    /**
     * Append an event and assign it the next sequence number.
     *
     * @return the stored event, with its sequence
     */
    Uni<SecurityEvent> append(SecurityEvent event);

    /**
     * Read events matching a query, newest first.
     */
    Uni<List<SecurityEvent>> query(SecurityEventQuery query);
}
