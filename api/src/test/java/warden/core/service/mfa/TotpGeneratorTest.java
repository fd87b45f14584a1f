package warden.core.service.mfa;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.config.MfaConfig;
import warden.testing.TestConfigs;

@DisplayName("TotpGenerator")
class TotpGeneratorTest {

    // Base32 of the ASCII seed "12345678901234567890" from RFC 6238 Appendix B
    private static final String RFC_SECRET = "GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ";

    private MfaConfig config;
    private TotpGenerator generator;

    @BeforeEach
    void setUp() {
        config = TestConfigs.mfa();
        generator = new TotpGenerator(config);
    }

    @Nested
    @DisplayName("generateCode()")
    class GenerateCodeTests {

        @Test
        @DisplayName("should match the RFC 6238 SHA1 vectors")
        void shouldMatchRfcVectors() {
            assertEquals("287082", generator.generateCode(RFC_SECRET, 59L));
            assertEquals("081804", generator.generateCode(RFC_SECRET, 1111111109L));
            assertEquals("050471", generator.generateCode(RFC_SECRET, 1111111111L));
            assertEquals("005924", generator.generateCode(RFC_SECRET, 1234567890L));
            assertEquals("279037", generator.generateCode(RFC_SECRET, 2000000000L));
        }

        @Test
        @DisplayName("should produce eight digits when configured")
        void shouldProduceEightDigits() {
            when(config.digits()).thenReturn(8);
            TotpGenerator eightDigits = new TotpGenerator(config);

            assertEquals("94287082", eightDigits.generateCode(RFC_SECRET, 59L));
            assertEquals("07081804", eightDigits.generateCode(RFC_SECRET, 1111111109L));
        }
    }

    @Nested
    @DisplayName("verify()")
    class VerifyTests {

        private final Instant now = Instant.ofEpochSecond(1234567890L);

        @Test
        @DisplayName("should accept the current code")
        void shouldAcceptCurrentCode() {
            assertTrue(generator.verify(RFC_SECRET, "005924", now));
        }

        @Test
        @DisplayName("should accept codes one step away")
        void shouldAcceptAdjacentSteps() {
            String previous = generator.generateCode(RFC_SECRET, now.getEpochSecond() - 30);
            String next = generator.generateCode(RFC_SECRET, now.getEpochSecond() + 30);

            assertTrue(generator.verify(RFC_SECRET, previous, now));
            assertTrue(generator.verify(RFC_SECRET, next, now));
        }

        @Test
        @DisplayName("should reject codes outside the window")
        void shouldRejectOutsideWindow() {
            String stale = generator.generateCode(RFC_SECRET, now.getEpochSecond() - 90);

            assertFalse(generator.verify(RFC_SECRET, stale, now));
        }

        @Test
        @DisplayName("should reject malformed codes")
        void shouldRejectMalformed() {
            assertFalse(generator.verify(RFC_SECRET, null, now));
            assertFalse(generator.verify(RFC_SECRET, "12345", now));
            assertFalse(generator.verify(RFC_SECRET, "0059245", now));
        }
    }

    @Nested
    @DisplayName("generateSecret()")
    class GenerateSecretTests {

        @Test
        @DisplayName("should return 32 base32 characters")
        void shouldReturnBase32() {
            String secret = generator.generateSecret();

            assertTrue(secret.matches("^[A-Z2-7]{32}$"), secret);
        }

        @Test
        @DisplayName("should verify codes from its own secrets")
        void shouldRoundTrip() {
            String secret = generator.generateSecret();
            Instant now = Instant.parse("2024-03-01T09:00:00Z");

            assertTrue(generator.verify(secret, generator.generateCode(secret, now.getEpochSecond()), now));
        }
    }

    @Test
    @DisplayName("should build an otpauth provisioning URI")
    void shouldBuildProvisioningUri() {
        String uri = generator.provisioningUri("Acme Corp", "alice@example.com", RFC_SECRET);

        assertEquals(
                "otpauth://totp/Acme%20Corp:alice%40example.com?secret=" + RFC_SECRET
                        + "&issuer=Acme%20Corp&algorithm=SHA1&digits=6&period=30",
                uri);
    }

    @Test
    @DisplayName("should reject unsupported settings")
    void shouldRejectUnsupportedSettings() {
        when(config.digits()).thenReturn(4);
        assertThrows(IllegalStateException.class, () -> new TotpGenerator(config));

        when(config.digits()).thenReturn(6);
        when(config.timeStep()).thenReturn(Duration.ZERO);
        assertThrows(IllegalStateException.class, () -> new TotpGenerator(config));
    }
}
