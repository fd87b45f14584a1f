package warden.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import warden.core.port.out.LockoutRepository;
import warden.core.port.out.MfaCredentialRepository;
import warden.core.port.out.PermissionGrantRepository;
import warden.core.port.out.SecurityEventRepository;
import warden.core.port.out.SessionRepository;
import warden.core.service.storage.StorageProviderRegistry;

/**
 * CDI producer for the security repositories.
 *
 * <p>Delegates to the {@link StorageProviderRegistry} which discovers and selects the
 * appropriate storage provider based on configuration and availability. All five
 * repositories always come from the same provider.
 *
 * @see warden.spi.SecurityStorageProvider
 */
@ApplicationScoped
public class StorageRepositoryProducer {

    private final StorageProviderRegistry registry;

    @Inject
    public StorageRepositoryProducer(StorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Produces
    @ApplicationScoped
    public SessionRepository sessionRepository() {
        return registry.getSelectedProvider().sessionRepository();
    }

    @Produces
    @ApplicationScoped
    public LockoutRepository lockoutRepository() {
        return registry.getSelectedProvider().lockoutRepository();
    }

    @Produces
    @ApplicationScoped
    public MfaCredentialRepository mfaCredentialRepository() {
        return registry.getSelectedProvider().mfaCredentialRepository();
    }

    @Produces
    @ApplicationScoped
    public PermissionGrantRepository permissionGrantRepository() {
        return registry.getSelectedProvider().permissionGrantRepository();
    }

    @Produces
    @ApplicationScoped
    public SecurityEventRepository securityEventRepository() {
        return registry.getSelectedProvider().securityEventRepository();
    }
}
