package warden.core.port.in;

import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Uni;

import warden.core.model.permission.PermissionCheckResult;
import warden.core.model.permission.PermissionDescriptor;
import warden.core.model.permission.PermissionGrant;
import warden.core.model.permission.PermissionUpdateResult;
import warden.core.model.permission.ScopedPermission;

/**
 * Inbound port for hierarchical API key permissions.
 */
public interface PermissionManagement {

    /**
     * Grants an unscoped permission.
     *
     * @see #addPermission(String, String, String)
     */
    Uni<Boolean> addPermission(String apiKeyId, String permission);

    /**
     * Grants a permission, optionally limited to a resource scope.
     *
     * @return true if granted, false if an identical grant already existed
     * @throws IllegalArgumentException if the permission is not in the catalog
     */
    Uni<Boolean> addPermission(String apiKeyId, String permission, String resourceScope);

    Uni<Boolean> removePermission(String apiKeyId, String permission);

    /**
     * Revokes a grant.
     *
     * @return true if a grant was removed
     * @throws IllegalArgumentException if the permission is not in the catalog
     */
    Uni<Boolean> removePermission(String apiKeyId, String permission, String resourceScope);

    /**
     * Checks a permission against the key's unscoped grants.
     *
     * <p>A grant satisfies the check when it is the same permission or a higher-ranked
     * permission of the same family. Unknown permissions are denied.
     */
    Uni<PermissionCheckResult> hasPermission(String apiKeyId, String permission);

    /**
     * Checks a permission for a resource scope. Unscoped grants and grants for the same
     * scope count.
     */
    Uni<PermissionCheckResult> hasPermission(String apiKeyId, String permission, String resourceScope);

    /**
     * Replaces every grant of a key. All entries are validated before anything changes.
     *
     * @throws IllegalArgumentException if any permission is not in the catalog
     */
    Uni<PermissionUpdateResult> setApiKeyPermissions(String apiKeyId, List<ScopedPermission> permissions);

    Uni<List<PermissionGrant>> getApiKeyPermissions(String apiKeyId);

    /**
     * Returns the permission catalog in display order, keyed by wire value.
     */
    Map<String, PermissionDescriptor> getAvailablePermissions();
}
