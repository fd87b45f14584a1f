package warden.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import io.smallrye.mutiny.Uni;

import warden.core.model.mfa.MfaCredential;
import warden.core.model.mfa.MfaType;
import warden.core.port.out.MfaCredentialRepository;

/**
 * In-memory implementation of MfaCredentialRepository.
 *
 * <p>This implementation is intended for development and testing only.
 * Credentials are lost on restart and not shared across instances.
 */
public class InMemoryMfaCredentialRepository implements MfaCredentialRepository {

    private final ConcurrentMap<CredentialKey, MfaCredential> credentials = new ConcurrentHashMap<>();

    @Override
    public Uni<Optional<MfaCredential>> savePending(MfaCredential credential) {
        return Uni.createFrom().item(() -> {
            AtomicReference<MfaCredential> saved = new AtomicReference<>();
            credentials.compute(new CredentialKey(credential.userId(), credential.type()), (key, current) -> {
                if (current != null && current.enabled()) {
                    return current;
                }
                saved.set(credential);
                return credential;
            });
            return Optional.ofNullable(saved.get());
        });
    }

    @Override
    public Uni<Optional<MfaCredential>> find(String userId, MfaType type) {
        return Uni.createFrom().item(() -> Optional.ofNullable(credentials.get(new CredentialKey(userId, type))));
    }

    @Override
    public Uni<Optional<MfaCredential>> update(String userId, MfaType type, UnaryOperator<MfaCredential> update) {
        return Uni.createFrom()
                .item(() -> Optional.ofNullable(
                        credentials.computeIfPresent(new CredentialKey(userId, type), (key, current) ->
                                update.apply(current))));
    }

    @Override
    public Uni<Optional<MfaCredential>> consumeBackupCode(String userId, MfaType type, String encryptedCode) {
        return Uni.createFrom().item(() -> {
            AtomicReference<MfaCredential> consumed = new AtomicReference<>();
            credentials.computeIfPresent(new CredentialKey(userId, type), (key, current) -> {
                if (!current.encryptedBackupCodes().contains(encryptedCode)) {
                    return current;
                }
                List<String> remaining = new ArrayList<>(current.encryptedBackupCodes());
                remaining.remove(encryptedCode);
                MfaCredential next = current.withBackupCodes(remaining);
                consumed.set(next);
                return next;
            });
            return Optional.ofNullable(consumed.get());
        });
    }

    @Override
    public Uni<Boolean> delete(String userId, MfaType type) {
        return Uni.createFrom().item(() -> credentials.remove(new CredentialKey(userId, type)) != null);
    }

    /**
     * Get the number of stored credentials (for health and testing).
     */
    public int getCredentialCount() {
        return credentials.size();
    }

    private record CredentialKey(String userId, MfaType type) {}
}
