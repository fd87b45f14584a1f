package warden.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import warden.core.port.out.LockoutRepository;
import warden.core.port.out.MfaCredentialRepository;
import warden.core.port.out.PermissionGrantRepository;
import warden.core.port.out.SecurityEventRepository;
import warden.core.port.out.SessionRepository;

/**
 * SPI for security storage backends.
 *
 * <p>Platform teams implement this interface to back sessions, lockout records, MFA
 * credentials, permission grants and the audit log with a durable store. Each
 * repository documents the atomic operations it must provide; a relational backend
 * typically maps them to unique keys plus conditional updates and row locks.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>memory (priority: 0) - In-memory storage (development and tests only)</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider (warden.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 *
 * <p>Providers are CDI beans; register a custom one by making it
 * {@code @ApplicationScoped}.
 */
public interface SecurityStorageProvider {

    /**
     * Return the provider name for configuration selection.
     *
     * @return provider name (e.g., "memory", "postgres")
     */
    String name();

    /**
     * Return the provider priority for automatic selection.
     *
     * @return priority value (higher = more preferred)
     */
    int priority();

    /**
     * Check if this provider is available and ready to use.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    SessionRepository sessionRepository();

    LockoutRepository lockoutRepository();

    MfaCredentialRepository mfaCredentialRepository();

    PermissionGrantRepository permissionGrantRepository();

    SecurityEventRepository securityEventRepository();

    /**
     * Create a health response for this storage backend.
     *
     * @return health check response, or empty if not supported
     */
    Optional<HealthCheckResponse> healthCheck();
}
