package warden.core.service.permission;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.audit.SecurityEvent;
import warden.core.model.audit.SecurityEventType;
import warden.core.model.audit.Severity;
import warden.core.model.permission.Permission;
import warden.core.model.permission.PermissionCheckResult;
import warden.core.model.permission.PermissionDescriptor;
import warden.core.model.permission.PermissionGrant;
import warden.core.model.permission.PermissionUpdateResult;
import warden.core.model.permission.ScopedPermission;
import warden.core.port.in.PermissionManagement;
import warden.core.port.out.PermissionGrantRepository;
import warden.core.service.audit.SecurityEventLog;

/**
 * Hierarchical permission grants for API keys.
 *
 * <p>A grant satisfies a check for any permission of the same family with lower or
 * equal rank: {@code chat:write} satisfies {@code chat:read}, {@code system:admin}
 * satisfies every {@code system:*} permission. Families never imply each other.
 *
 * <p>Scoped grants only count for checks against the same scope. Unscoped grants count
 * for every check.
 */
@ApplicationScoped
public class PermissionService implements PermissionManagement {

    private static final Logger LOG = Logger.getLogger(PermissionService.class);

    private static final Map<String, PermissionDescriptor> CATALOG = buildCatalog();

    private static final Set<Permission> ADMINISTRATIVE =
            EnumSet.of(Permission.ADMIN, Permission.SYSTEM_ADMIN, Permission.USERS_ADMIN);

    private final PermissionGrantRepository repository;
    private final SecurityEventLog eventLog;
    private final Clock clock;

    @Inject
    public PermissionService(PermissionGrantRepository repository, SecurityEventLog eventLog, Clock clock) {
        this.repository = repository;
        this.eventLog = eventLog;
        this.clock = clock;
    }

    private static Map<String, PermissionDescriptor> buildCatalog() {
        Map<String, PermissionDescriptor> catalog = new LinkedHashMap<>();
        for (Permission permission : Permission.values()) {
            catalog.put(permission.value(), PermissionDescriptor.of(permission));
        }
        return Collections.unmodifiableMap(catalog);
    }

    @Override
    public Uni<Boolean> addPermission(String apiKeyId, String permission) {
        return addPermission(apiKeyId, permission, null);
    }

    @Override
    public Uni<Boolean> addPermission(String apiKeyId, String permission, String resourceScope) {
        requireApiKeyId(apiKeyId);
        Permission resolved = Permission.fromValue(permission);
        String scope = normalizeScope(resourceScope);
        Instant now = clock.instant();

        return repository.add(new PermissionGrant(apiKeyId, resolved, scope, now)).call(added -> {
            if (!added) {
                LOG.debugf("Permission %s already granted to API key %s", resolved, apiKeyId);
                return Uni.createFrom().voidItem();
            }
            LOG.infof("Granted %s to API key %s%s", resolved, apiKeyId, scopeSuffix(scope));
            Severity severity = ADMINISTRATIVE.contains(resolved) ? Severity.WARNING : Severity.INFO;
            return eventLog.record(event(SecurityEventType.PERMISSION_GRANTED, severity, apiKeyId, now)
                    .description("Permission granted: " + resolved.value())
                    .metadata("permission", resolved.value())
                    .metadata("resourceScope", scope)
                    .build());
        });
    }

    @Override
    public Uni<Boolean> removePermission(String apiKeyId, String permission) {
        return removePermission(apiKeyId, permission, null);
    }

    @Override
    public Uni<Boolean> removePermission(String apiKeyId, String permission, String resourceScope) {
        requireApiKeyId(apiKeyId);
        Permission resolved = Permission.fromValue(permission);
        String scope = normalizeScope(resourceScope);

        return repository.remove(apiKeyId, resolved, scope).call(removed -> {
            if (!removed) {
                return Uni.createFrom().voidItem();
            }
            LOG.infof("Revoked %s from API key %s%s", resolved, apiKeyId, scopeSuffix(scope));
            return eventLog.record(event(SecurityEventType.PERMISSION_REVOKED, Severity.INFO, apiKeyId, clock.instant())
                    .description("Permission revoked: " + resolved.value())
                    .metadata("permission", resolved.value())
                    .metadata("resourceScope", scope)
                    .build());
        });
    }

    @Override
    public Uni<PermissionCheckResult> hasPermission(String apiKeyId, String permission) {
        return check(apiKeyId, permission, grant -> !grant.isScoped());
    }

    @Override
    public Uni<PermissionCheckResult> hasPermission(String apiKeyId, String permission, String resourceScope) {
        String scope = normalizeScope(resourceScope);
        if (scope == null) {
            return hasPermission(apiKeyId, permission);
        }
        return check(apiKeyId, permission, grant -> !grant.isScoped() || scope.equals(grant.resourceScope()));
    }

    private Uni<PermissionCheckResult> check(String apiKeyId, String permission, Predicate<PermissionGrant> inScope) {
        Optional<Permission> required = Permission.find(permission);
        if (apiKeyId == null || apiKeyId.isBlank() || required.isEmpty()) {
            return Uni.createFrom().item(PermissionCheckResult.denied());
        }

        return repository.findByApiKeyId(apiKeyId).map(grants -> grants.stream()
                .filter(inScope)
                .filter(grant -> grant.permission().implies(required.get()))
                // Report the narrowest grant that satisfies the check
                .min(Comparator.comparingInt((PermissionGrant grant) -> grant.permission().rank())
                        .thenComparing(PermissionGrant::isScoped, Comparator.reverseOrder()))
                .map(PermissionCheckResult::allowedBy)
                .orElseGet(PermissionCheckResult::denied));
    }

    @Override
    public Uni<PermissionUpdateResult> setApiKeyPermissions(String apiKeyId, List<ScopedPermission> permissions) {
        requireApiKeyId(apiKeyId);
        Objects.requireNonNull(permissions, "permissions");
        Instant now = clock.instant();

        // Validate everything before touching the store
        Map<String, PermissionGrant> unique = new LinkedHashMap<>();
        for (ScopedPermission entry : permissions) {
            Objects.requireNonNull(entry, "permission entry");
            Permission resolved = Permission.fromValue(entry.permission());
            String scope = normalizeScope(entry.resourceScope());
            unique.putIfAbsent(resolved.value() + "|" + scope, new PermissionGrant(apiKeyId, resolved, scope, now));
        }
        List<PermissionGrant> grants = new ArrayList<>(unique.values());

        return repository.replaceAll(apiKeyId, grants).flatMap(stored -> {
            LOG.infof("Replaced permissions of API key %s: %d grant(s)", apiKeyId, stored.size());
            return eventLog.record(event(SecurityEventType.PERMISSIONS_REPLACED, Severity.INFO, apiKeyId, now)
                            .description("Permission set replaced")
                            .metadata("count", stored.size())
                            .metadata(
                                    "permissions",
                                    stored.stream()
                                            .map(grant -> grant.permission().value() + scopeSuffix(grant.resourceScope()))
                                            .toList())
                            .build())
                    .replaceWith(new PermissionUpdateResult(true, stored.size()));
        });
    }

    @Override
    public Uni<List<PermissionGrant>> getApiKeyPermissions(String apiKeyId) {
        requireApiKeyId(apiKeyId);
        return repository.findByApiKeyId(apiKeyId);
    }

    @Override
    public Map<String, PermissionDescriptor> getAvailablePermissions() {
        return CATALOG;
    }

    private static SecurityEvent.Builder event(
            SecurityEventType type, Severity severity, String apiKeyId, Instant createdAt) {
        return SecurityEvent.builder(type, severity).metadata("apiKeyId", apiKeyId).createdAt(createdAt);
    }

    private static String normalizeScope(String scope) {
        return scope == null || scope.isBlank() ? null : scope.strip();
    }

    private static String scopeSuffix(String scope) {
        return scope != null ? " [" + scope + "]" : "";
    }

    private static void requireApiKeyId(String apiKeyId) {
        if (apiKeyId == null || apiKeyId.isBlank()) {
            throw new IllegalArgumentException("apiKeyId must not be blank");
        }
    }
}
