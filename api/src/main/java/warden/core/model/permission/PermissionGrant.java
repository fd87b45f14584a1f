package warden.core.model.permission;

import java.time.Instant;
import java.util.Objects;

/**
 * A permission granted to an API key, optionally limited to one resource scope.
 *
 * <p>Grants are unique per (apiKeyId, permission, resourceScope).
 */
public record PermissionGrant(String apiKeyId, Permission permission, String resourceScope, Instant grantedAt) {

    public boolean isScoped() {
        return resourceScope != null;
    }

    /**
     * Check whether this grant has the same identity as another, ignoring grant time.
     */
    public boolean sameGrant(String otherApiKeyId, Permission otherPermission, String otherScope) {
        return apiKeyId.equals(otherApiKeyId)
                && permission == otherPermission
                && Objects.equals(resourceScope, otherScope);
    }
}
