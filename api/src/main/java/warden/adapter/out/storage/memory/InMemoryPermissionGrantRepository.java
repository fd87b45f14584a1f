package warden.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

import io.smallrye.mutiny.Uni;

import warden.core.model.permission.Permission;
import warden.core.model.permission.PermissionGrant;
import warden.core.port.out.PermissionGrantRepository;

/**
 * In-memory implementation of PermissionGrantRepository.
 *
 * <p>This implementation is intended for development and testing only.
 * Each key's grants are held as one immutable list swapped atomically, so readers
 * never observe a partially replaced set.
 */
public class InMemoryPermissionGrantRepository implements PermissionGrantRepository {

    private final ConcurrentMap<String, List<PermissionGrant>> grantsByKey = new ConcurrentHashMap<>();

    @Override
    public Uni<Boolean> add(PermissionGrant grant) {
        return Uni.createFrom().item(() -> {
            AtomicBoolean added = new AtomicBoolean(false);
            grantsByKey.compute(grant.apiKeyId(), (key, current) -> {
                List<PermissionGrant> existing = current != null ? current : List.of();
                boolean duplicate = existing.stream()
                        .anyMatch(g -> g.sameGrant(grant.apiKeyId(), grant.permission(), grant.resourceScope()));
                if (duplicate) {
                    return current;
                }
                List<PermissionGrant> next = new ArrayList<>(existing);
                next.add(grant);
                added.set(true);
                return List.copyOf(next);
            });
            return added.get();
        });
    }

    @Override
    public Uni<Boolean> remove(String apiKeyId, Permission permission, String resourceScope) {
        return Uni.createFrom().item(() -> {
            AtomicBoolean removed = new AtomicBoolean(false);
            grantsByKey.computeIfPresent(apiKeyId, (key, current) -> {
                List<PermissionGrant> next = current.stream()
                        .filter(g -> !g.sameGrant(apiKeyId, permission, resourceScope))
                        .toList();
                removed.set(next.size() != current.size());
                return next.isEmpty() ? null : next;
            });
            return removed.get();
        });
    }

    @Override
    public Uni<List<PermissionGrant>> findByApiKeyId(String apiKeyId) {
        return Uni.createFrom().item(() -> grantsByKey.getOrDefault(apiKeyId, List.of()));
    }

    @Override
    public Uni<List<PermissionGrant>> replaceAll(String apiKeyId, List<PermissionGrant> grants) {
        return Uni.createFrom().item(() -> {
            List<PermissionGrant> next = List.copyOf(grants);
            if (next.isEmpty()) {
                grantsByKey.remove(apiKeyId);
            } else {
                grantsByKey.put(apiKeyId, next);
            }
            return next;
        });
    }
}
