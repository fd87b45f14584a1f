package warden.core.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Redaction")
class RedactionTest {

    @Test
    @DisplayName("should keep only a session id prefix")
    void shouldTruncateSessionId() {
        assertEquals("abcdef01...", Redaction.sessionId("abcdef0123456789".repeat(4)));
        assertEquals("short", Redaction.sessionId("short"));
    }

    @Test
    @DisplayName("should hash identifiers stably")
    void shouldHashIdentifiers() {
        String hashed = Redaction.identifier("alice@example.com");

        assertEquals(12, hashed.length());
        assertEquals(hashed, Redaction.identifier("alice@example.com"));
        assertNotEquals(hashed, Redaction.identifier("bob@example.com"));
        assertFalse(hashed.contains("alice"));
    }
}
