package warden.core.service.session;

import java.security.SecureRandom;
import java.util.HexFormat;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Generate cryptographically secure session IDs.
 *
 * <p>Session IDs are 32 bytes (256 bits) of random data encoded as 64 lowercase
 * hexadecimal characters.
 */
@ApplicationScoped
public class SessionIdGenerator {

    private static final int SESSION_ID_BYTES = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    /**
     * Generate a new session ID.
     *
     * @return 64 lowercase hex characters
     */
    public String generate() {
        byte[] bytes = new byte[SESSION_ID_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return HEX.formatHex(bytes);
    }
}
