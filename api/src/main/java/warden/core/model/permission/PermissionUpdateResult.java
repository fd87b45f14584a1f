package warden.core.model.permission;

/**
 * Outcome of replacing the full grant set of an API key.
 *
 * @param success whether the replacement was applied
 * @param count   number of grants the key now holds
 */
public record PermissionUpdateResult(boolean success, int count) {}
