package warden.core.port.out;

import warden.core.model.audit.SecurityEvent;

/**
 * Outbound port for fanning stored audit events out to handlers.
 *
 * <p>Publishing is fire-and-forget and must never throw.
 */
public interface SecurityEventPublisher {

    void publish(SecurityEvent event);
}
