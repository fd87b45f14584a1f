package warden.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.permission.Permission;
import warden.core.model.permission.PermissionGrant;

/**
 * Outbound port for API key permission grants.
 *
 * <p>Grants are unique per (apiKeyId, permission, resourceScope); a null scope is a
 * distinct value from any non-null scope.
 */
public interface PermissionGrantRepository {

    /**
     * Insert a grant if it does not already exist.
     *
     * @return true if inserted, false if an identical grant already existed
     */
    Uni<Boolean> add(PermissionGrant grant);

    /**
     * Remove a grant.
     *
     * @return true if a grant was removed
     */
    Uni<Boolean> remove(String apiKeyId, Permission permission, String resourceScope);

    Uni<List<PermissionGrant>> findByApiKeyId(String apiKeyId);

    /**
     * Atomically replace every grant of a key.
     *
     * <p>Readers observe either the old set or the new set, never a mix.
     *
     * @return the stored grant set
     */
    Uni<List<PermissionGrant>> replaceAll(String apiKeyId, List<PermissionGrant> grants);
}
