package warden.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for TOTP multi-factor authentication.
 *
 * <p>Configuration prefix: {@code warden.mfa}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code WARDEN_MFA_ENCRYPTION_KEY} - Base64-encoded 256-bit AES key (required)</li>
 *   <li>{@code WARDEN_MFA_ENCRYPTION_KEY_ID} - Identifier stored with each ciphertext</li>
 * </ul>
 *
 * @see warden.core.service.mfa.MfaService
 */
@ConfigMapping(prefix = "warden.mfa")
public interface MfaConfig {

    /**
     * Issuer shown in authenticator apps.
     *
     * @return issuer (default: Warden)
     */
    @WithDefault("Warden")
    String issuer();

    /**
     * TOTP time step.
     *
     * @return step (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration timeStep();

    /**
     * Number of digits in a TOTP code.
     *
     * @return digits (default: 6)
     */
    @WithDefault("6")
    int digits();

    /**
     * Number of adjacent time steps accepted on each side of the current one.
     *
     * @return window (default: 1)
     */
    @WithDefault("1")
    int window();

    /**
     * Number of backup codes issued at setup and on regeneration.
     *
     * @return count (default: 10)
     */
    @WithDefault("10")
    int backupCodeCount();

    /**
     * Secret encryption settings.
     */
    Encryption encryption();

    interface Encryption {

        /**
         * Base64-encoded 256-bit AES key.
         *
         * <p>Startup fails when the key is absent.
         *
         * @return the key, if configured
         */
        Optional<String> key();

        /**
         * Identifier stored alongside every ciphertext.
         *
         * @return key id (default: v1)
         */
        @WithDefault("v1")
        String keyId();
    }
}
