package warden.core.model.audit;

import java.util.Locale;

/**
 * Severity of a security event.
 */
public enum Severity {
    INFO,
    WARNING,
    CRITICAL;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
