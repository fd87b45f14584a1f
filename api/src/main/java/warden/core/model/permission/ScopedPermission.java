package warden.core.model.permission;

/**
 * A permission value paired with an optional resource scope, as supplied by callers.
 */
public record ScopedPermission(String permission, String resourceScope) {

    public static ScopedPermission of(String permission) {
        return new ScopedPermission(permission, null);
    }

    public static ScopedPermission of(String permission, String resourceScope) {
        return new ScopedPermission(permission, resourceScope);
    }
}
