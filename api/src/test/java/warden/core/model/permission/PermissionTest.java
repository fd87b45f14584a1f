package warden.core.model.permission;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Permission")
class PermissionTest {

    @Test
    @DisplayName("should imply lower ranks within the same family")
    void shouldImplyWithinFamily() {
        assertTrue(Permission.CHAT_WRITE.implies(Permission.CHAT_READ));
        assertTrue(Permission.ARTIFACTS_DELETE.implies(Permission.ARTIFACTS_WRITE));
        assertTrue(Permission.ARTIFACTS_DELETE.implies(Permission.ARTIFACTS_READ));
        assertTrue(Permission.SYSTEM_ADMIN.implies(Permission.SYSTEM_MONITOR));
        assertTrue(Permission.SYSTEM_WRITE.implies(Permission.SYSTEM_MONITOR));
        assertTrue(Permission.USERS_ADMIN.implies(Permission.USERS_READ));
        assertTrue(Permission.ADMIN.implies(Permission.READ));
        assertTrue(Permission.CHAT_READ.implies(Permission.CHAT_READ));
    }

    @Test
    @DisplayName("should not imply higher ranks or other families")
    void shouldNotImplyAcrossFamilies() {
        assertFalse(Permission.CHAT_READ.implies(Permission.CHAT_WRITE));
        assertFalse(Permission.SYSTEM_ADMIN.implies(Permission.CHAT_READ));
        assertFalse(Permission.ARTIFACTS_DELETE.implies(Permission.USERS_READ));
        assertFalse(Permission.SYSTEM_MONITOR.implies(Permission.SYSTEM_WRITE));
        assertFalse(Permission.ADMIN.implies(Permission.CHAT_READ));
        assertFalse(Permission.USERS_ADMIN.implies(Permission.SYSTEM_ADMIN));
    }

    @Test
    @DisplayName("should resolve wire values")
    void shouldResolveValues() {
        assertEquals(Optional.of(Permission.USERS_WRITE), Permission.find("users:write"));
        assertEquals(Optional.of(Permission.DELETE), Permission.find("delete"));
        assertEquals(Optional.empty(), Permission.find("models:read"));
        assertEquals(Optional.empty(), Permission.find(null));
        assertEquals(Permission.SYSTEM_READ, Permission.fromValue("system:read"));
        assertThrows(IllegalArgumentException.class, () -> Permission.fromValue("chat:admin"));
    }

    @Test
    @DisplayName("should list every storable permission value")
    void shouldListCatalog() {
        Set<String> values = Arrays.stream(Permission.values()).map(Permission::value).collect(Collectors.toSet());

        assertEquals(
                Set.of(
                        "read", "write", "delete", "admin",
                        "chat:read", "chat:write", "chat:delete",
                        "artifacts:read", "artifacts:write", "artifacts:delete",
                        "system:read", "system:write", "system:monitor", "system:admin",
                        "users:read", "users:write", "users:admin"),
                values);
    }
}
