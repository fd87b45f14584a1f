package warden.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Helpers for logging identifiers without exposing them.
 *
 * <p>Session IDs are bearer secrets and are logged as a short prefix. Emails and other
 * personal identifiers are logged as a truncated SHA-256 digest, which stays stable
 * across log lines so repeated failures can still be correlated.
 */
public final class Redaction {

    private static final int SESSION_PREFIX_LENGTH = 8;
    private static final int IDENTIFIER_HASH_LENGTH = 12;

    private Redaction() {}

    /**
     * Returns the first eight characters of a session ID followed by an ellipsis.
     */
    public static String sessionId(String sessionId) {
        if (sessionId == null) {
            return "null";
        }
        if (sessionId.length() <= SESSION_PREFIX_LENGTH) {
            return sessionId;
        }
        return sessionId.substring(0, SESSION_PREFIX_LENGTH) + "...";
    }

    /**
     * Returns a twelve-character hex digest of an identifier.
     */
    public static String identifier(String identifier) {
        if (identifier == null) {
            return "null";
        }
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            final var hash = digest.digest(identifier.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, IDENTIFIER_HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 is required on every JVM", e);
        }
    }
}
