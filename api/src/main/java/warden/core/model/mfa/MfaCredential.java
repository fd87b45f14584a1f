package warden.core.model.mfa;

import java.time.Instant;
import java.util.List;

/**
 * Stored second-factor credential for one (user, type) pair.
 *
 * <p>The secret and every backup code are encrypted individually. A consumed backup
 * code is removed from {@code encryptedBackupCodes} and never comes back.
 *
 * @param userId               owning user
 * @param type                 second-factor method
 * @param encryptedSecret      encrypted shared secret
 * @param encryptedBackupCodes encrypted, unused backup codes
 * @param enabled              set on first successful verification
 * @param verified             set on first successful verification
 * @param createdAt            setup time
 * @param lastUsedAt           last successful verification (may be null)
 * @param failureCount         failed verifications since the last success
 */
public record MfaCredential(
        String userId,
        MfaType type,
        String encryptedSecret,
        List<String> encryptedBackupCodes,
        boolean enabled,
        boolean verified,
        Instant createdAt,
        Instant lastUsedAt,
        int failureCount) {

    public MfaCredential {
        encryptedBackupCodes = List.copyOf(encryptedBackupCodes);
    }

    /**
     * Creates a credential for a freshly initiated setup.
     */
    public static MfaCredential pending(
            String userId, MfaType type, String encryptedSecret, List<String> encryptedBackupCodes, Instant now) {
        return new MfaCredential(userId, type, encryptedSecret, encryptedBackupCodes, false, false, now, null, 0);
    }

    /**
     * Records a successful verification. The first success also enables the credential.
     */
    public MfaCredential withSuccess(Instant at) {
        return new MfaCredential(
                userId, type, encryptedSecret, encryptedBackupCodes, true, true, createdAt, at, 0);
    }

    /**
     * Records a successful backup-code login. Does not change enablement.
     */
    public MfaCredential withLastUsed(Instant at) {
        return new MfaCredential(
                userId, type, encryptedSecret, encryptedBackupCodes, enabled, verified, createdAt, at, 0);
    }

    public MfaCredential withFailure() {
        return new MfaCredential(
                userId,
                type,
                encryptedSecret,
                encryptedBackupCodes,
                enabled,
                verified,
                createdAt,
                lastUsedAt,
                failureCount + 1);
    }

    public MfaCredential withBackupCodes(List<String> codes) {
        return new MfaCredential(
                userId, type, encryptedSecret, codes, enabled, verified, createdAt, lastUsedAt, failureCount);
    }
}
