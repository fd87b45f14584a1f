package warden.core.model.permission;

import java.util.Optional;

/**
 * Catalog of permissions that can be granted to an API key.
 *
 * <p>Permissions are grouped in families. Within a family a permission implies every
 * permission of lower or equal rank; different families never imply each other. The bare
 * {@code read}/{@code write}/{@code delete}/{@code admin} values form their own family.
 */
public enum Permission {
    READ("read", "general", 1, "Read access to resources the key is scoped to"),
    WRITE("write", "general", 2, "Create and update resources the key is scoped to"),
    DELETE("delete", "general", 3, "Delete resources the key is scoped to"),
    ADMIN("admin", "general", 4, "Administer resources the key is scoped to"),
    CHAT_READ("chat:read", "chat", 1, "Read chat conversations and history"),
    CHAT_WRITE("chat:write", "chat", 2, "Send chat messages and manage conversations"),
    CHAT_DELETE("chat:delete", "chat", 3, "Delete chat conversations"),
    ARTIFACTS_READ("artifacts:read", "artifacts", 1, "Read artifacts"),
    ARTIFACTS_WRITE("artifacts:write", "artifacts", 2, "Create and update artifacts"),
    ARTIFACTS_DELETE("artifacts:delete", "artifacts", 3, "Delete artifacts"),
    SYSTEM_READ("system:read", "system", 1, "Read system status"),
    SYSTEM_MONITOR("system:monitor", "system", 2, "Read metrics and health details"),
    SYSTEM_WRITE("system:write", "system", 3, "Change system settings"),
    SYSTEM_ADMIN("system:admin", "system", 4, "Full administrative access to system operations"),
    USERS_READ("users:read", "users", 1, "Read user accounts"),
    USERS_WRITE("users:write", "users", 2, "Create and update user accounts"),
    USERS_ADMIN("users:admin", "users", 3, "Manage user roles, lockouts and sessions");

    private final String value;
    private final String family;
    private final int rank;
    private final String description;

    Permission(String value, String family, int rank, String description) {
        this.value = value;
        this.family = family;
        this.rank = rank;
        this.description = description;
    }

    public String value() {
        return value;
    }

    public String family() {
        return family;
    }

    public int rank() {
        return rank;
    }

    public String description() {
        return description;
    }

    /**
     * Check whether holding this permission satisfies a check for {@code required}.
     */
    public boolean implies(Permission required) {
        return family.equals(required.family) && rank >= required.rank;
    }

    /**
     * Look up a permission by its wire value, e.g. {@code chat:read}.
     */
    public static Optional<Permission> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Permission permission : values()) {
            if (permission.value.equals(value)) {
                return Optional.of(permission);
            }
        }
        return Optional.empty();
    }

    /**
     * Look up a permission by its wire value.
     *
     * @throws IllegalArgumentException if the value is not in the catalog
     */
    public static Permission fromValue(String value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown permission: " + value));
    }

    @Override
    public String toString() {
        return value;
    }
}
