package warden.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import warden.core.service.storage.StorageProviderRegistry;
import warden.spi.SecurityStorageProvider;
import warden.spi.StorageProviderException;

/**
 * Readiness check for the selected security storage provider.
 *
 * <p>Reports the provider's own health response when it offers one, and DOWN when no
 * provider can be selected.
 */
@Readiness
@ApplicationScoped
public class SecurityStorageHealthCheck implements HealthCheck {

    private final StorageProviderRegistry registry;

    @Inject
    public SecurityStorageHealthCheck(StorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        SecurityStorageProvider provider;
        try {
            provider = registry.getSelectedProvider();
        } catch (StorageProviderException e) {
            return HealthCheckResponse.named("security-storage")
                    .down()
                    .withData("error", e.getMessage())
                    .build();
        }

        return provider.healthCheck()
                .orElseGet(() -> HealthCheckResponse.named("security-storage")
                        .up()
                        .withData("provider", provider.name())
                        .build());
    }
}
