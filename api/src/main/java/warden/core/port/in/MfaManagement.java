package warden.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.mfa.MfaRequirements;
import warden.core.model.mfa.MfaStatus;
import warden.core.model.mfa.MfaVerificationResult;
import warden.core.model.mfa.TotpSetup;

/**
 * Inbound port for TOTP multi-factor authentication.
 */
public interface MfaManagement {

    /**
     * Starts TOTP setup: generates a secret and a fresh set of backup codes.
     *
     * <p>The credential stays disabled until the first successful {@link #verifyTotp}.
     * Running setup again before that replaces the pending credential.
     *
     * @param userId user identifier
     * @param email  account label shown in authenticator apps
     * @return the secret, provisioning URI and backup codes
     * @throws MfaException if MFA is already enabled for the user
     */
    Uni<TotpSetup> generateTotpSecret(String userId, String email);

    /**
     * Verifies a TOTP token, falling back to a backup code.
     *
     * @param userId user identifier
     * @param token  six-digit TOTP code or {@code XXXX-XXXX} backup code
     * @return the verification result; never fails for a wrong token
     * @throws MfaSecretDecryptionException (as a failed Uni) if stored material cannot be decrypted
     */
    Uni<MfaVerificationResult> verifyTotp(String userId, String token);

    /**
     * Replaces the user's backup codes with a new set.
     *
     * @return the new plaintext codes
     * @throws MfaException if the user has no TOTP credential
     */
    Uni<List<String>> regenerateBackupCodes(String userId);

    Uni<MfaStatus> getMfaStatus(String userId);

    Uni<Boolean> isMfaEnabled(String userId);

    /**
     * Removes the user's TOTP credential.
     *
     * @return true if a credential was removed
     */
    Uni<Boolean> disableMfa(String userId);

    /**
     * Returns the second-factor policy for a role. Unknown roles get the free-tier policy.
     */
    MfaRequirements validateMfaRequirements(String role);

    /**
     * Exception thrown when an MFA operation is not allowed in the current state.
     */
    class MfaException extends RuntimeException {
        public MfaException(String message) {
            super(message);
        }

        public MfaException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Exception thrown when stored MFA material cannot be decrypted.
     *
     * <p>Never treated as "not configured".
     */
    class MfaSecretDecryptionException extends MfaException {
        public MfaSecretDecryptionException(String message) {
            super(message);
        }

        public MfaSecretDecryptionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
