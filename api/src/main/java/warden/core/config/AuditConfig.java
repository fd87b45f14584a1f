package warden.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the security audit log.
 *
 * <p>Configuration prefix: {@code warden.audit}
 */
@ConfigMapping(prefix = "warden.audit")
public interface AuditConfig {

    /**
     * Dispatch recorded events to the discovered security event handlers.
     *
     * @return true if dispatch is enabled (default: true)
     */
    @WithDefault("true")
    boolean dispatchEnabled();
}
