package warden.core.model.common;

/**
 * Client attributes captured by the transport layer for an authentication-related call.
 *
 * @param ipAddress client IP address ({@value #UNKNOWN_IP} when the caller could not resolve it)
 * @param userAgent client user agent (may be null)
 * @param mobile    whether the client identified itself as a mobile device
 */
public record ClientMetadata(String ipAddress, String userAgent, boolean mobile) {

    public static final String UNKNOWN_IP = "unknown";

    public ClientMetadata {
        if (ipAddress == null || ipAddress.isBlank()) {
            ipAddress = UNKNOWN_IP;
        }
    }

    public static ClientMetadata of(String ipAddress, String userAgent) {
        return new ClientMetadata(ipAddress, userAgent, false);
    }

    public static ClientMetadata unknown() {
        return new ClientMetadata(UNKNOWN_IP, null, false);
    }
}
