package warden.core.service.mfa;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.runtime.Startup;
import org.jboss.logging.Logger;

import warden.core.config.MfaConfig;
import warden.core.port.in.MfaManagement.MfaSecretDecryptionException;

/**
 * Encryption service for MFA secrets and backup codes at rest.
 *
 * <p>Uses AES-256-GCM with a random 12-byte IV per operation, so identical plaintexts
 * never produce identical ciphertexts. The ciphertext is self-describing:
 * <pre>
 * {keyId}:{base64 iv}:{base64 ciphertext+tag}
 * </pre>
 *
 * <h2>Configuration</h2>
 * <pre>
 * warden.mfa.encryption.key=${WARDEN_MFA_ENCRYPTION_KEY}  # Base64-encoded 256-bit key
 * warden.mfa.encryption.key-id=v1                         # For future key rotation
 * </pre>
 *
 * <p>There is no plaintext fallback: the application refuses to start without a key.
 */
@Startup
@ApplicationScoped
public class MfaSecretEncryptionService {

    private static final Logger LOG = Logger.getLogger(MfaSecretEncryptionService.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final int KEY_LENGTH = 32;
    static final String SEPARATOR = ":";

    private final SecretKey secretKey;
    private final String keyId;
    private final SecureRandom secureRandom = new SecureRandom();

    @Inject
    public MfaSecretEncryptionService(MfaConfig config) {
        String encodedKey = config.encryption()
                .key()
                .filter(key -> !key.isBlank())
                .orElseThrow(() -> new IllegalStateException(
                        "MFA encryption key is not configured. Set warden.mfa.encryption.key."));

        final byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(encodedKey.strip());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("warden.mfa.encryption.key is not valid base64", e);
        }
        if (keyBytes.length != KEY_LENGTH) {
            throw new IllegalStateException(
                    "Encryption key must be 256 bits (32 bytes). Got: " + keyBytes.length + " bytes");
        }

        this.keyId = config.encryption().keyId();
        if (keyId.isBlank() || keyId.contains(SEPARATOR)) {
            throw new IllegalStateException("warden.mfa.encryption.key-id must be non-blank and must not contain ':'");
        }
        this.secretKey = new SecretKeySpec(keyBytes, "AES");
        LOG.infof("MFA secret encryption enabled with key ID: %s", keyId);
    }

    /**
     * Encrypt a secret for storage.
     *
     * @param plaintext secret or backup code
     * @return {@code keyId:iv:ciphertext}
     */
    public String encrypt(String plaintext) {
        try {
            final byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            final byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            final Base64.Encoder encoder = Base64.getEncoder();
            return keyId + SEPARATOR + encoder.encodeToString(iv) + SEPARATOR + encoder.encodeToString(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt MFA secret", e);
        }
    }

    /**
     * Decrypt a stored secret.
     *
     * @param encrypted value produced by {@link #encrypt(String)}
     * @return the plaintext
     * @throws MfaSecretDecryptionException on malformed input, wrong key or tampering
     */
    public String decrypt(String encrypted) {
        if (encrypted == null) {
            throw new MfaSecretDecryptionException("Encrypted MFA secret is missing");
        }
        final String[] parts = encrypted.split(SEPARATOR, -1);
        if (parts.length != 3) {
            throw new MfaSecretDecryptionException("Malformed encrypted MFA secret");
        }
        if (!keyId.equals(parts[0])) {
            LOG.warnf("Key ID mismatch: expected %s, got %s. Key rotation may be needed.", keyId, parts[0]);
        }

        try {
            final Base64.Decoder decoder = Base64.getDecoder();
            final byte[] iv = decoder.decode(parts[1]);
            final byte[] ciphertext = decoder.decode(parts[2]);
            if (iv.length != IV_LENGTH) {
                throw new MfaSecretDecryptionException("Malformed encrypted MFA secret");
            }

            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new MfaSecretDecryptionException("Failed to decrypt MFA secret", e);
        }
    }

    public String keyId() {
        return keyId;
    }
}
