package warden.core.port.out;

import java.util.Optional;
import java.util.function.UnaryOperator;

import io.smallrye.mutiny.Uni;

import warden.core.model.mfa.MfaCredential;
import warden.core.model.mfa.MfaType;

/**
 * Outbound port for MFA credential storage, keyed by (userId, type).
 *
 * <p>Implementations only ever see encrypted secrets and backup codes.
 */
public interface MfaCredentialRepository {

    /**
     * Atomically store a pending credential, replacing an existing one for the same key
     * only while that one is not enabled.
     *
     * @return the stored credential, or empty if an enabled credential is in place
     */
    Uni<Optional<MfaCredential>> savePending(MfaCredential credential);

    Uni<Optional<MfaCredential>> find(String userId, MfaType type);

    /**
     * Atomically update an existing credential.
     *
     * @return the updated credential, or empty if none exists
     */
    Uni<Optional<MfaCredential>> update(String userId, MfaType type, UnaryOperator<MfaCredential> update);

    /**
     * Atomically remove one encrypted backup code.
     *
     * <p>Exactly one of any number of concurrent callers removing the same code succeeds.
     *
     * @param encryptedCode the stored ciphertext of the code to remove
     * @return the credential after removal, or empty if the code was not present
     */
    Uni<Optional<MfaCredential>> consumeBackupCode(String userId, MfaType type, String encryptedCode);

    /**
     * Delete a credential.
     *
     * @return true if a credential was deleted
     */
    Uni<Boolean> delete(String userId, MfaType type);
}
