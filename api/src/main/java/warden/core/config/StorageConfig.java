package warden.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for security storage provider selection.
 *
 * <p>Configuration prefix: {@code warden.storage}
 *
 * @see warden.core.service.storage.StorageProviderRegistry
 */
@ConfigMapping(prefix = "warden.storage")
public interface StorageConfig {

    /**
     * Name of the storage provider to use. Falls back to the highest-priority
     * available provider when the named one is not available.
     *
     * @return provider name (default: memory)
     */
    @WithDefault("memory")
    String provider();
}
