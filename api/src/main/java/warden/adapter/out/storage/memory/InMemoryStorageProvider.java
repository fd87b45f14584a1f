package warden.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import warden.core.port.out.LockoutRepository;
import warden.core.port.out.MfaCredentialRepository;
import warden.core.port.out.PermissionGrantRepository;
import warden.core.port.out.SecurityEventRepository;
import warden.core.port.out.SessionRepository;
import warden.spi.SecurityStorageProvider;

/**
 * In-memory security storage provider.
 *
 * <p>This provider is always available and serves as the fallback when no durable
 * backend is registered.
 *
 * <p><strong>Warning:</strong> Nothing is persisted across restarts and nothing is shared
 * between instances. Lockouts and sessions held here do not protect a multi-instance
 * deployment. Not recommended for production.
 */
@ApplicationScoped
public class InMemoryStorageProvider implements SecurityStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryStorageProvider.class);
    private static final int PRIORITY = 0; // Lowest priority - fallback only

    private final AtomicBoolean warningLogged = new AtomicBoolean(false);

    private final InMemorySessionRepository sessions = new InMemorySessionRepository();
    private final InMemoryLockoutRepository lockouts = new InMemoryLockoutRepository();
    private final InMemoryMfaCredentialRepository mfaCredentials = new InMemoryMfaCredentialRepository();
    private final InMemoryPermissionGrantRepository permissionGrants = new InMemoryPermissionGrantRepository();
    private final InMemorySecurityEventRepository securityEvents = new InMemorySecurityEventRepository();

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true; // Always available
    }

    @Override
    public SessionRepository sessionRepository() {
        logWarningOnce();
        return sessions;
    }

    @Override
    public LockoutRepository lockoutRepository() {
        logWarningOnce();
        return lockouts;
    }

    @Override
    public MfaCredentialRepository mfaCredentialRepository() {
        logWarningOnce();
        return mfaCredentials;
    }

    @Override
    public PermissionGrantRepository permissionGrantRepository() {
        logWarningOnce();
        return permissionGrants;
    }

    @Override
    public SecurityEventRepository securityEventRepository() {
        logWarningOnce();
        return securityEvents;
    }

    private void logWarningOnce() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: Security storage is in-memory only!");
            LOG.warn("  Sessions, lockouts, MFA credentials and audit events are lost on");
            LOG.warn("  restart and are not shared between instances.");
            LOG.warn("  Register a durable SecurityStorageProvider for production.");
            LOG.warn("========================================================================");
        }
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("security-storage-memory")
                .up()
                .withData("type", "in-memory")
                .withData("sessions", sessions.getSessionCount())
                .withData("lockoutRecords", lockouts.getRecordCount())
                .withData("mfaCredentials", mfaCredentials.getCredentialCount())
                .withData("securityEvents", securityEvents.getEventCount())
                .build());
    }
}
