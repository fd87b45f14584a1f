package warden.core.service.storage;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import warden.core.config.StorageConfig;
import warden.spi.SecurityStorageProvider;
import warden.spi.StorageProviderException;

/**
 * Registry for security storage providers.
 *
 * <p>Discovers available providers via CDI and selects the appropriate one
 * based on configuration and availability.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider (warden.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class StorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(StorageProviderRegistry.class);

    private final Instance<SecurityStorageProvider> providers;
    private final StorageConfig config;

    private volatile SecurityStorageProvider selectedProvider;

    @Inject
    public StorageProviderRegistry(Instance<SecurityStorageProvider> providers, StorageConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Select the provider at startup so a misconfiguration fails fast.
     */
    void onStart(@Observes StartupEvent event) {
        LOG.infof("Security storage provider initialized: %s", getSelectedProvider().name());
    }

    /**
     * Get the selected storage provider.
     *
     * @return selected provider
     * @throws StorageProviderException if no provider is available
     */
    public SecurityStorageProvider getSelectedProvider() {
        SecurityStorageProvider provider = selectedProvider;
        if (provider == null) {
            synchronized (this) {
                if (selectedProvider == null) {
                    selectedProvider = selectProvider();
                }
                provider = selectedProvider;
            }
        }
        return provider;
    }

    private SecurityStorageProvider selectProvider() {
        String configuredProvider = config.provider();
        List<SecurityStorageProvider> availableProviders = getAvailableProviders().stream()
                .sorted(Comparator.comparingInt(SecurityStorageProvider::priority)
                        .reversed())
                .toList();

        LOG.debugf(
                "Available security storage providers: %s",
                availableProviders.stream().map(SecurityStorageProvider::name).toList());

        // First, try to find the configured provider
        Optional<SecurityStorageProvider> configured = availableProviders.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();

        if (configured.isPresent()) {
            LOG.infof("Using configured security storage provider: %s", configuredProvider);
            return configured.get();
        }

        if (availableProviders.isEmpty()) {
            throw new StorageProviderException("No security storage providers available");
        }

        LOG.warnf("Configured security storage provider '%s' is not available, falling back", configuredProvider);
        SecurityStorageProvider provider = availableProviders.get(0);
        LOG.infof("Using security storage provider: %s (priority: %d)", provider.name(), provider.priority());
        return provider;
    }

    /**
     * Get all available providers (for health checks).
     *
     * @return list of available providers
     */
    public List<SecurityStorageProvider> getAvailableProviders() {
        return providers.stream().filter(SecurityStorageProvider::isAvailable).toList();
    }
}
