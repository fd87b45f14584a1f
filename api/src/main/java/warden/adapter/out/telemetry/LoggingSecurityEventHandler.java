package warden.adapter.out.telemetry;

import java.util.Map;
import java.util.TreeMap;

import org.jboss.logging.Logger;

import warden.core.model.audit.SecurityEvent;
import warden.core.util.Redaction;
import warden.spi.SecurityEventHandler;

/**
 * Security event handler that logs events using JBoss Logging.
 *
 * <p>This is a built-in handler with priority 0 that always runs.
 * Log levels are based on event severity:
 * <ul>
 *   <li>INFO severity → DEBUG level</li>
 *   <li>WARNING severity → WARN level</li>
 *   <li>CRITICAL severity → ERROR level</li>
 * </ul>
 *
 * <p>Session IDs and lockout identifiers are redacted before they are written.
 */
public class LoggingSecurityEventHandler implements SecurityEventHandler {

    private static final Logger LOG = Logger.getLogger("warden.security");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public String description() {
        return "Logs security events using JBoss Logging";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public void handle(SecurityEvent event) {
        switch (event.severity()) {
            case INFO -> {
                if (LOG.isDebugEnabled()) {
                    LOG.debug(formatEvent(event));
                }
            }
            case WARNING -> LOG.warn(formatEvent(event));
            case CRITICAL -> LOG.error(formatEvent(event));
        }
    }

    static String formatEvent(SecurityEvent event) {
        Map<String, Object> metadata = new TreeMap<>(event.metadata());
        metadata.computeIfPresent("identifier", (key, value) -> Redaction.identifier(String.valueOf(value)));

        return String.format(
                "%s: seq=%d user=%s session=%s ip=%s description=%s metadata=%s",
                event.eventType().name(),
                event.sequence(),
                event.userId() != null ? event.userId() : "-",
                event.sessionId() != null ? Redaction.sessionId(event.sessionId()) : "-",
                event.ipAddress(),
                event.description(),
                metadata);
    }
}
