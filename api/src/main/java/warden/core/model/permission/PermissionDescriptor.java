package warden.core.model.permission;

/**
 * Catalog entry exposed for UI listing and ordering.
 */
public record PermissionDescriptor(String description, int level) {

    public static PermissionDescriptor of(Permission permission) {
        return new PermissionDescriptor(permission.description(), permission.rank());
    }
}
