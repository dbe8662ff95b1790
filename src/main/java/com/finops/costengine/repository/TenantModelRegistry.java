package com.finops.costengine.repository;

import com.finops.costengine.model.TenantModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Current model snapshot per tenant.
 *
 * Publishing stores the new version durably first and only then swaps the in-memory entry,
 * so concurrent scoring keeps reading the previous snapshot until the new one is complete.
 * Publishes for the same tenant are serialized; different tenants never contend.
 */
@Component
public class TenantModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(TenantModelRegistry.class);

    private final ModelSnapshotRepository snapshotRepository;
    private final Map<String, TenantModel> current = new ConcurrentHashMap<>();
    private final Map<String, Object> publishLocks = new ConcurrentHashMap<>();

    public TenantModelRegistry(ModelSnapshotRepository snapshotRepository) {
        this.snapshotRepository = snapshotRepository;
    }

    /**
     * Assign the next version to the model, persist it and make it current.
     *
     * @return the published snapshot, carrying its version
     */
    public TenantModel publish(TenantModel model) {
        String tenantId = model.getTenantId();
        synchronized (publishLocks.computeIfAbsent(tenantId, k -> new Object())) {
            long nextVersion = find(tenantId).map(TenantModel::getVersion).orElse(0L) + 1;
            TenantModel versioned = model.withVersion(nextVersion);

            snapshotRepository.save(versioned);
            current.put(tenantId, versioned);

            log.info("Published model v{} for {}", nextVersion, tenantId);
            return versioned;
        }
    }

    /**
     * Current snapshot of the tenant, falling back to the durable store after a restart.
     */
    public Optional<TenantModel> find(String tenantId) {
        TenantModel cached = current.get(tenantId);
        if (cached != null) return Optional.of(cached);

        Optional<TenantModel> stored = snapshotRepository.loadLatest(tenantId);
        stored.ifPresent(model -> current.merge(tenantId, model,
                (existing, loaded) -> existing.getVersion() >= loaded.getVersion() ? existing : loaded));
        return stored.map(model -> current.get(tenantId));
    }

    public void evict(String tenantId) {
        current.remove(tenantId);
    }
}
