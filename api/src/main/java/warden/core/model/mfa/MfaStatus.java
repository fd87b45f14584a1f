package warden.core.model.mfa;

import java.time.Instant;

/**
 * Summary of a user's second-factor state.
 *
 * @param enabled          whether MFA is enforced for the user
 * @param verified         whether setup was ever completed
 * @param type             configured method (null when none)
 * @param backupCodesCount unused backup codes
 * @param createdAt        setup time (null when none)
 * @param lastUsedAt       last successful verification (null when none)
 */
public record MfaStatus(
        boolean enabled, boolean verified, MfaType type, int backupCodesCount, Instant createdAt, Instant lastUsedAt) {

    public static MfaStatus none() {
        return new MfaStatus(false, false, null, 0, null, null);
    }

    public static MfaStatus of(MfaCredential credential) {
        return new MfaStatus(
                credential.enabled(),
                credential.verified(),
                credential.type(),
                credential.encryptedBackupCodes().size(),
                credential.createdAt(),
                credential.lastUsedAt());
    }
}
