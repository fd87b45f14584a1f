package warden.adapter.out.telemetry;

import java.util.Locale;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import warden.core.model.audit.SecurityEvent;
import warden.core.model.audit.SecurityEventType;
import warden.spi.SecurityEventHandler;

/**
 * Security event handler that records events as Micrometer metrics.
 *
 * <p>This is a built-in handler with priority 10 that records security
 * events to the metrics registry for monitoring and alerting.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code warden.security.events.total} - Total events by type and severity</li>
 *   <li>{@code warden.security.lockouts} - Lockouts applied, by level and identifier type</li>
 *   <li>{@code warden.security.session.invalidated} - Session endings by reason</li>
 *   <li>{@code warden.security.mfa.failures} - Rejected MFA tokens</li>
 * </ul>
 */
public class MetricsSecurityEventHandler implements SecurityEventHandler {

    private MeterRegistry registry;

    public MetricsSecurityEventHandler() {
        // Default constructor for ServiceLoader
    }

    public MetricsSecurityEventHandler(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Set the meter registry.
     *
     * <p>Called by the dispatcher after ServiceLoader instantiation.
     *
     * @param registry the Micrometer registry
     */
    public void setMeterRegistry(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public String description() {
        return "Records security events as Micrometer metrics";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        return registry != null;
    }

    @Override
    public void handle(SecurityEvent event) {
        if (registry == null) {
            return;
        }

        recordEventCounter(event);

        SecurityEventType type = event.eventType();
        if (type == SecurityEventType.ACCOUNT_LOCKED) {
            recordLockout(event);
        } else if (type == SecurityEventType.SESSION_INVALIDATED) {
            recordSessionInvalidated(event);
        } else if (type == SecurityEventType.MFA_FAILED) {
            recordMfaFailure();
        }
    }

    private void recordEventCounter(SecurityEvent event) {
        Counter.builder("warden.security.events.total")
                .description("Total security events")
                .tag("event_type", event.eventType().value())
                .tag("severity", event.severity().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    private void recordLockout(SecurityEvent event) {
        Counter.builder("warden.security.lockouts")
                .description("Lockouts applied after repeated authentication failures")
                .tag("level", metadata(event, "lockLevel"))
                .tag("lockout_type", metadata(event, "lockoutType"))
                .register(registry)
                .increment();
    }

    private void recordSessionInvalidated(SecurityEvent event) {
        Counter.builder("warden.security.session.invalidated")
                .description("Session invalidations")
                .tag("reason", metadata(event, "reason"))
                .register(registry)
                .increment();
    }

    private void recordMfaFailure() {
        Counter.builder("warden.security.mfa.failures")
                .description("Rejected MFA tokens")
                .register(registry)
                .increment();
    }

    private static String metadata(SecurityEvent event, String key) {
        Object value = event.metadata().get(key);
        return value != null ? value.toString() : "unknown";
    }
}
