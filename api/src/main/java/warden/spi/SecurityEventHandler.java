package warden.spi;

import warden.core.model.audit.SecurityEvent;

/**
 * SPI for reacting to recorded security events.
 *
 * <p>Platform teams can implement this interface to integrate with their alerting and
 * monitoring systems. Handlers receive events after they have been written to the audit
 * store. Implementations are discovered via {@link java.util.ServiceLoader}.
 *
 * <p>Built-in handlers:
 * <ul>
 *   <li>{@code logging} - Logs events using JBoss Logging (priority 0)</li>
 *   <li>{@code metrics} - Records events as Micrometer metrics (priority 10)</li>
 * </ul>
 *
 * <p>Example implementation:
 * <pre>{@code
 * public class PagerDutySecurityEventHandler implements SecurityEventHandler {
 *     @Override
 *     public String name() { return "pagerduty"; }
 *
 *     @Override
 *     public int priority() { return 100; }
 *
 *     @Override
 *     public void handle(SecurityEvent event) {
 *         if (event.severity() == Severity.CRITICAL) {
 *             pagerDutyClient.trigger(createIncident(event));
 *         }
 *     }
 * }
 * }</pre>
 *
 * <p>Register implementations in:
 * {@code META-INF/services/warden.spi.SecurityEventHandler}
 */
public interface SecurityEventHandler {

    /**
     * Returns the unique name of this handler.
     *
     * @return handler name (e.g., "pagerduty", "slack", "webhook")
     */
    String name();

    default String description() {
        return name() + " security event handler";
    }

    /**
     * Returns the priority of this handler. Higher priority handlers are invoked first.
     *
     * @return priority value
     */
    default int priority() {
        return 0;
    }

    /**
     * Returns whether this handler should receive events.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Handle a security event.
     *
     * <p>Implementations should catch and log their own exceptions; a thrown exception
     * is logged by the dispatcher and does not reach other handlers or the caller.
     *
     * @param event the stored security event
     */
    void handle(SecurityEvent event);

    /**
     * Called during shutdown to release any resources.
     */
    default void close() {}
}
