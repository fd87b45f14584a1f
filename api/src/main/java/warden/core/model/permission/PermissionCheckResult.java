package warden.core.model.permission;

/**
 * Outcome of a permission check.
 *
 * @param allowed   whether the key holds the permission or one implying it
 * @param grantedBy the grant that satisfied the check (null when denied)
 */
public record PermissionCheckResult(boolean allowed, PermissionGrant grantedBy) {

    public static PermissionCheckResult denied() {
        return new PermissionCheckResult(false, null);
    }

    public static PermissionCheckResult allowedBy(PermissionGrant grant) {
        return new PermissionCheckResult(true, grant);
    }
}
