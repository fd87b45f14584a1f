package warden.testing;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

import java.time.Duration;
import java.util.Base64;
import java.util.Optional;

import org.mockito.quality.Strictness;

import warden.core.config.AuditConfig;
import warden.core.config.LockoutConfig;
import warden.core.config.MfaConfig;
import warden.core.config.SessionConfig;
import warden.core.config.StorageConfig;

/**
 * Lenient config mocks carrying the production defaults. Tests override single values
 * with {@code when(...)} on the returned mock.
 */
public final class TestConfigs {

    public static final String ENCRYPTION_KEY = Base64.getEncoder().encodeToString(new byte[] {
        1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16,
        17, 18, 19, 20, 21, 22, 23, 24, 25, 26, 27, 28, 29, 30, 31, 32
    });

    private TestConfigs() {}

    public static SessionConfig session() {
        SessionConfig config = lenientMock(SessionConfig.class);
        SessionConfig.IdGeneration idGeneration = lenientMock(SessionConfig.IdGeneration.class);
        SessionConfig.Cleanup cleanup = lenientMock(SessionConfig.Cleanup.class);
        SessionConfig.SuspiciousActivity suspicious = lenientMock(SessionConfig.SuspiciousActivity.class);

        when(config.defaultTimeout()).thenReturn(Duration.ofHours(24));
        when(config.maxAbsoluteLifetime()).thenReturn(Duration.ofDays(7));
        when(config.maxSessionsPerUser()).thenReturn(5);
        when(config.idGeneration()).thenReturn(idGeneration);
        when(config.cleanup()).thenReturn(cleanup);
        when(config.suspiciousActivity()).thenReturn(suspicious);

        when(idGeneration.maxRetries()).thenReturn(3);
        when(cleanup.enabled()).thenReturn(true);
        when(cleanup.interval()).thenReturn("5m");
        when(suspicious.similarityEnabled()).thenReturn(true);
        when(suspicious.userAgentMinLength()).thenReturn(10);
        when(suspicious.similarityThreshold()).thenReturn(0.8);
        when(suspicious.lengthDifferenceThreshold()).thenReturn(20);
        return config;
    }

    public static LockoutConfig lockout() {
        LockoutConfig config = lenientMock(LockoutConfig.class);
        when(config.levelOneDuration()).thenReturn(Duration.ofMinutes(1));
        when(config.levelTwoDuration()).thenReturn(Duration.ofMinutes(15));
        when(config.levelThreeDuration()).thenReturn(Duration.ofHours(1));
        when(config.levelFourDuration()).thenReturn(Duration.ofHours(24));
        return config;
    }

    public static MfaConfig mfa() {
        return mfa(ENCRYPTION_KEY);
    }

    public static MfaConfig mfa(String encryptionKey) {
        MfaConfig config = lenientMock(MfaConfig.class);
        MfaConfig.Encryption encryption = lenientMock(MfaConfig.Encryption.class);
        when(config.issuer()).thenReturn("Warden");
        when(config.timeStep()).thenReturn(Duration.ofSeconds(30));
        when(config.digits()).thenReturn(6);
        when(config.window()).thenReturn(1);
        when(config.backupCodeCount()).thenReturn(10);
        when(config.encryption()).thenReturn(encryption);
        when(encryption.key()).thenReturn(Optional.ofNullable(encryptionKey));
        when(encryption.keyId()).thenReturn("v1");
        return config;
    }

    public static StorageConfig storage(String provider) {
        StorageConfig config = lenientMock(StorageConfig.class);
        when(config.provider()).thenReturn(provider);
        return config;
    }

    public static AuditConfig audit(boolean dispatchEnabled) {
        AuditConfig config = lenientMock(AuditConfig.class);
        when(config.dispatchEnabled()).thenReturn(dispatchEnabled);
        return config;
    }

    private static <T> T lenientMock(Class<T> type) {
        return mock(type, withSettings().strictness(Strictness.LENIENT));
    }
}
