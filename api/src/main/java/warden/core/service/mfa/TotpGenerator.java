package warden.core.service.mfa;

import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Instant;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.apache.commons.codec.binary.Base32;

import warden.core.config.MfaConfig;

/**
 * RFC 6238 time-based one-time passwords.
 *
 * <p>HMAC-SHA1 over the big-endian time counter with dynamic truncation. Secrets are
 * 160 bits of {@link SecureRandom} output, base32-encoded without padding (32
 * characters). Verification accepts the current time step and {@code window} steps on
 * either side, and compares codes in constant time.
 */
@ApplicationScoped
public class TotpGenerator {

    private static final int SECRET_BYTES = 20;
    private static final String HMAC_ALGORITHM = "HmacSHA1";
    private static final String URI_FORMAT =
            "otpauth://totp/%s:%s?secret=%s&issuer=%s&algorithm=SHA1&digits=%d&period=%d";

    private final SecureRandom secureRandom = new SecureRandom();
    private final Base32 base32 = new Base32();
    private final long timeStepSeconds;
    private final int digits;
    private final int window;
    private final int modulus;

    @Inject
    public TotpGenerator(MfaConfig config) {
        this.timeStepSeconds = config.timeStep().toSeconds();
        this.digits = config.digits();
        this.window = config.window();
        if (timeStepSeconds <= 0) {
            throw new IllegalStateException("warden.mfa.time-step must be at least one second");
        }
        if (digits < 6 || digits > 8) {
            throw new IllegalStateException("warden.mfa.digits must be between 6 and 8: " + digits);
        }
        int mod = 1;
        for (int i = 0; i < digits; i++) {
            mod *= 10;
        }
        this.modulus = mod;
    }

    /**
     * Generate a new base32 secret.
     *
     * @return 32 base32 characters
     */
    public String generateSecret() {
        byte[] bytes = new byte[SECRET_BYTES];
        secureRandom.nextBytes(bytes);
        return base32.encodeToString(bytes).replace("=", "");
    }

    /**
     * Compute the code for the time step containing {@code epochSeconds}.
     */
    public String generateCode(String secret, long epochSeconds) {
        byte[] key = base32.decode(secret);
        long counter = Math.floorDiv(epochSeconds, timeStepSeconds);
        byte[] message = ByteBuffer.allocate(Long.BYTES).putLong(counter).array();

        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
            byte[] hash = mac.doFinal(message);

            int offset = hash[hash.length - 1] & 0x0F;
            int binary = ((hash[offset] & 0x7F) << 24)
                    | ((hash[offset + 1] & 0xFF) << 16)
                    | ((hash[offset + 2] & 0xFF) << 8)
                    | (hash[offset + 3] & 0xFF);

            return String.format("%0" + digits + "d", binary % modulus);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA1 must be available", e);
        }
    }

    /**
     * Check a code against the current time step and its neighbours.
     *
     * @param secret base32 secret
     * @param code   code supplied by the user
     * @param now    verification time
     * @return true if the code matches any step in the window
     */
    public boolean verify(String secret, String code, Instant now) {
        if (code == null || code.length() != digits) {
            return false;
        }
        long epochSeconds = now.getEpochSecond();
        boolean matched = false;
        // Check every step so timing does not reveal which one matched
        for (int i = -window; i <= window; i++) {
            String expected = generateCode(secret, epochSeconds + i * timeStepSeconds);
            matched |= constantTimeEquals(expected, code);
        }
        return matched;
    }

    /**
     * Build the {@code otpauth://} URI authenticator apps scan from a QR code.
     */
    public String provisioningUri(String issuer, String accountName, String secret) {
        String encodedIssuer = encode(issuer);
        return String.format(
                URI_FORMAT, encodedIssuer, encode(accountName), secret, encodedIssuer, digits, timeStepSeconds);
    }

    static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
