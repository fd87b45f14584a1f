package warden.core.service.mfa;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.MfaConfig;
import warden.core.model.audit.SecurityEvent;
import warden.core.model.audit.SecurityEventType;
import warden.core.model.audit.Severity;
import warden.core.model.mfa.MfaCredential;
import warden.core.model.mfa.MfaRequirements;
import warden.core.model.mfa.MfaStatus;
import warden.core.model.mfa.MfaType;
import warden.core.model.mfa.MfaVerificationResult;
import warden.core.model.mfa.TotpSetup;
import warden.core.port.in.MfaManagement;
import warden.core.port.out.MfaCredentialRepository;
import warden.core.service.audit.SecurityEventLog;

/**
 * TOTP multi-factor authentication.
 *
 * <p>Setup stores an encrypted secret and encrypted backup codes in a disabled,
 * unverified credential. The first successful TOTP verification verifies and enables
 * it. Backup codes are accepted only once the credential is enabled, and each is
 * removed from the store atomically when used.
 *
 * <p>Tokens, secrets and backup codes are never logged.
 */
@ApplicationScoped
public class MfaService implements MfaManagement {

    private static final Logger LOG = Logger.getLogger(MfaService.class);

    static final String DEFAULT_ROLE = "free";

    private static final String ALREADY_ENABLED = "MFA is already enabled. Disable it before setting it up again.";

    private static final Map<String, MfaRequirements> ROLE_REQUIREMENTS = Map.of(
            "admin", new MfaRequirements(true, List.of(MfaType.TOTP)),
            "premium", new MfaRequirements(false, List.of(MfaType.TOTP)),
            DEFAULT_ROLE, new MfaRequirements(false, List.of(MfaType.TOTP)));

    private final MfaCredentialRepository repository;
    private final TotpGenerator totp;
    private final BackupCodeGenerator backupCodes;
    private final MfaSecretEncryptionService encryption;
    private final SecurityEventLog eventLog;
    private final MfaConfig config;
    private final Clock clock;

    @Inject
    public MfaService(
            MfaCredentialRepository repository,
            TotpGenerator totp,
            BackupCodeGenerator backupCodes,
            MfaSecretEncryptionService encryption,
            SecurityEventLog eventLog,
            MfaConfig config,
            Clock clock) {
        this.repository = repository;
        this.totp = totp;
        this.backupCodes = backupCodes;
        this.encryption = encryption;
        this.eventLog = eventLog;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<TotpSetup> generateTotpSecret(String userId, String email) {
        requireNonBlank(userId, "userId");
        requireNonBlank(email, "email");

        return repository.find(userId, MfaType.TOTP).flatMap(existing -> {
            if (existing.isPresent() && existing.get().enabled()) {
                return Uni.createFrom()
                        .failure(new MfaException(ALREADY_ENABLED));
            }

            Instant now = clock.instant();
            String secret = totp.generateSecret();
            List<String> codes = backupCodes.generate();
            MfaCredential credential = MfaCredential.pending(
                    userId, MfaType.TOTP, encryption.encrypt(secret), encryptAll(codes), now);

            return repository.savePending(credential).flatMap(saved -> {
                if (saved.isEmpty()) {
                    // Enabled concurrently
                    return Uni.createFrom().failure(new MfaException(ALREADY_ENABLED));
                }
                LOG.infof("TOTP setup initiated for user %s", userId);
                return eventLog.record(event(SecurityEventType.MFA_SETUP_INITIATED, Severity.INFO, userId)
                                .description("TOTP setup initiated")
                                .metadata("replacedPending", existing.isPresent())
                                .build())
                        .replaceWith(new TotpSetup(
                                secret,
                                totp.provisioningUri(config.issuer(), email, secret),
                                manualEntryKey(secret),
                                codes));
            });
        });
    }

    @Override
    public Uni<MfaVerificationResult> verifyTotp(String userId, String token) {
        requireNonBlank(userId, "userId");

        return repository.find(userId, MfaType.TOTP).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(MfaVerificationResult.notConfigured());
            }

            MfaCredential credential = found.get();
            Instant now = clock.instant();
            String secret = encryption.decrypt(credential.encryptedSecret());
            String candidate = token != null ? token.replace(" ", "") : "";

            if (totp.verify(secret, candidate, now)) {
                return acceptTotp(credential, now);
            }
            return tryBackupCode(credential, candidate, now);
        });
    }

    private Uni<MfaVerificationResult> acceptTotp(MfaCredential credential, Instant now) {
        String userId = credential.userId();
        boolean firstVerification = !credential.enabled();

        return repository.update(userId, MfaType.TOTP, current -> current.withSuccess(now)).flatMap(updated -> {
            if (updated.isEmpty()) {
                // Disabled concurrently
                return Uni.createFrom().item(MfaVerificationResult.notConfigured());
            }
            int remaining = updated.get().encryptedBackupCodes().size();

            Uni<Void> enabled = Uni.createFrom().voidItem();
            if (firstVerification) {
                LOG.infof("MFA enabled for user %s", userId);
                enabled = eventLog.record(event(SecurityEventType.MFA_ENABLED, Severity.INFO, userId)
                                .description("TOTP verified for the first time, MFA enabled")
                                .build())
                        .replaceWithVoid();
            }

            return enabled.chain(() -> eventLog.record(event(SecurityEventType.MFA_VERIFIED, Severity.INFO, userId)
                            .description("TOTP verified")
                            .build()))
                    .replaceWith(MfaVerificationResult.totpAccepted(remaining));
        });
    }

    private Uni<MfaVerificationResult> tryBackupCode(MfaCredential credential, String candidate, Instant now) {
        Optional<String> match =
                credential.enabled() ? findBackupCode(credential, candidate) : Optional.empty();
        if (match.isEmpty()) {
            return reject(credential);
        }

        String userId = credential.userId();
        return repository
                .consumeBackupCode(userId, MfaType.TOTP, match.get())
                .flatMap(consumed -> {
                    if (consumed.isEmpty()) {
                        // Used by a concurrent verification
                        return reject(credential);
                    }
                    return repository
                            .update(userId, MfaType.TOTP, current -> current.withLastUsed(now))
                            .flatMap(updated -> {
                                int remaining = updated.map(c -> c.encryptedBackupCodes().size())
                                        .orElse(consumed.get().encryptedBackupCodes().size());
                                LOG.infof("Backup code used by user %s, %d remaining", userId, remaining);
                                return eventLog.record(event(
                                                        SecurityEventType.BACKUP_CODE_USED, Severity.WARNING, userId)
                                                .description("Backup code used")
                                                .metadata("remainingBackupCodes", remaining)
                                                .build())
                                        .replaceWith(MfaVerificationResult.backupCodeAccepted(remaining));
                            });
                });
    }

    private Optional<String> findBackupCode(MfaCredential credential, String candidate) {
        String normalized = BackupCodeGenerator.normalize(candidate);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        String match = null;
        // Decrypt and compare every code so timing does not reveal the position
        for (String encrypted : credential.encryptedBackupCodes()) {
            if (TotpGenerator.constantTimeEquals(encryption.decrypt(encrypted), normalized) && match == null) {
                match = encrypted;
            }
        }
        return Optional.ofNullable(match);
    }

    private Uni<MfaVerificationResult> reject(MfaCredential credential) {
        String userId = credential.userId();
        return repository.update(userId, MfaType.TOTP, MfaCredential::withFailure).flatMap(updated -> {
            int failures = updated.map(MfaCredential::failureCount).orElse(credential.failureCount() + 1);
            int remaining = updated.map(c -> c.encryptedBackupCodes().size()).orElse(0);
            LOG.debugf("MFA verification failed for user %s (failures=%d)", userId, failures);
            return eventLog.record(event(SecurityEventType.MFA_FAILED, Severity.WARNING, userId)
                            .description("Invalid MFA token")
                            .metadata("failureCount", failures)
                            .build())
                    .replaceWith(MfaVerificationResult.rejected(MfaVerificationResult.INVALID_TOKEN, remaining));
        });
    }

    @Override
    public Uni<List<String>> regenerateBackupCodes(String userId) {
        requireNonBlank(userId, "userId");
        List<String> codes = backupCodes.generate();
        List<String> encrypted = encryptAll(codes);

        return repository
                .update(userId, MfaType.TOTP, current -> current.withBackupCodes(encrypted))
                .flatMap(updated -> {
                    if (updated.isEmpty()) {
                        return Uni.createFrom().failure(new MfaException("MFA is not configured for user " + userId));
                    }
                    LOG.infof("Backup codes regenerated for user %s", userId);
                    return eventLog.record(event(SecurityEventType.BACKUP_CODES_REGENERATED, Severity.INFO, userId)
                                    .description("Backup codes regenerated")
                                    .metadata("count", codes.size())
                                    .build())
                            .replaceWith(List.copyOf(codes));
                });
    }

    @Override
    public Uni<MfaStatus> getMfaStatus(String userId) {
        requireNonBlank(userId, "userId");
        return repository.find(userId, MfaType.TOTP).map(found -> found.map(MfaStatus::of)
                .orElseGet(MfaStatus::none));
    }

    @Override
    public Uni<Boolean> isMfaEnabled(String userId) {
        requireNonBlank(userId, "userId");
        return repository.find(userId, MfaType.TOTP).map(found -> found.map(MfaCredential::enabled)
                .orElse(false));
    }

    @Override
    public Uni<Boolean> disableMfa(String userId) {
        requireNonBlank(userId, "userId");
        return repository.delete(userId, MfaType.TOTP).flatMap(deleted -> {
            if (!deleted) {
                return Uni.createFrom().item(false);
            }
            LOG.infof("MFA disabled for user %s", userId);
            return eventLog.record(event(SecurityEventType.MFA_DISABLED, Severity.WARNING, userId)
                            .description("MFA disabled")
                            .build())
                    .replaceWith(true);
        });
    }

    @Override
    public MfaRequirements validateMfaRequirements(String role) {
        String key = role != null ? role.strip().toLowerCase(Locale.ROOT) : DEFAULT_ROLE;
        return ROLE_REQUIREMENTS.getOrDefault(key, ROLE_REQUIREMENTS.get(DEFAULT_ROLE));
    }

    private List<String> encryptAll(List<String> codes) {
        return codes.stream().map(encryption::encrypt).toList();
    }

    private SecurityEvent.Builder event(SecurityEventType type, Severity severity, String userId) {
        return SecurityEvent.builder(type, severity)
                .userId(userId)
                .metadata("mfaType", MfaType.TOTP.value())
                .createdAt(clock.instant());
    }

    static String manualEntryKey(String secret) {
        StringBuilder grouped = new StringBuilder();
        for (int i = 0; i < secret.length(); i += 4) {
            if (i > 0) {
                grouped.append(' ');
            }
            grouped.append(secret, i, Math.min(i + 4, secret.length()));
        }
        return grouped.toString();
    }

    private static void requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
