package com.finops.costengine.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finops.costengine.config.AerospikeConfig;
import com.finops.costengine.exception.ModelPersistenceException;
import com.finops.costengine.model.TenantModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Durable store of tenant model snapshots.
 *
 * Every version is written once under its own key ({@code tenantId:vN}); a separate pointer
 * record names the current version. The pointer only moves after the snapshot write succeeded,
 * so a reader always resolves to a complete snapshot. A snapshot whose pointer write failed is
 * removed, or replaced by the next publish of the same version.
 */
@Repository
public class ModelSnapshotRepository {

    private static final Logger log = LoggerFactory.getLogger(ModelSnapshotRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final WritePolicy createOnlyPolicy;
    private final WritePolicy replacePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public ModelSnapshotRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                   @Qualifier("createOnlyWritePolicy") WritePolicy createOnlyPolicy,
                                   @Qualifier("defaultReadPolicy") Policy readPolicy,
                                   ObjectMapper objectMapper) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.createOnlyPolicy = createOnlyPolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = objectMapper;
        this.replacePolicy = new WritePolicy(writePolicy);
        this.replacePolicy.recordExistsAction = RecordExistsAction.REPLACE;
    }

    public void save(TenantModel model) {
        String modelJson;
        try {
            modelJson = objectMapper.writeValueAsString(model);
        } catch (JsonProcessingException e) {
            throw new ModelPersistenceException("Failed to encode model for " + model.getTenantId(), e);
        }

        Key snapshotKey = snapshotKey(model.getTenantId(), model.getVersion());
        Bin[] snapshotBins = {
                new Bin("tenantId", model.getTenantId()),
                new Bin("version", model.getVersion()),
                new Bin("modelJson", modelJson),
                new Bin("treeCount", model.getForest().getTrees().size()),
                new Bin("trainSamples", model.getTrainingSamples()),
                new Bin("trainedAt", model.getTrainedAt().toEpochMilli())
        };

        try {
            writeSnapshot(model, snapshotKey, snapshotBins);
        } catch (AerospikeException e) {
            throw new ModelPersistenceException(
                    "Failed to store model v" + model.getVersion() + " for " + model.getTenantId(), e);
        }

        try {
            client.put(writePolicy, pointerKey(model.getTenantId()),
                    new Bin("tenantId", model.getTenantId()),
                    new Bin("version", model.getVersion()));
        } catch (AerospikeException e) {
            ModelPersistenceException failure = new ModelPersistenceException(
                    "Failed to move model pointer to v" + model.getVersion() + " for " + model.getTenantId(), e);
            discardOrphan(model, snapshotKey, failure);
            throw failure;
        }

        log.info("Stored model v{} for {}: {} trees, {} samples",
                model.getVersion(), model.getTenantId(), model.getForest().getTrees().size(),
                model.getTrainingSamples());
    }

    /**
     * Snapshot versions are create-only. A snapshot that already exists under the version being
     * published was left by an earlier publish whose pointer write failed; no pointer names it,
     * so it is replaced.
     */
    private void writeSnapshot(TenantModel model, Key key, Bin[] bins) {
        try {
            client.put(createOnlyPolicy, key, bins);
        } catch (AerospikeException e) {
            if (e.getResultCode() != ResultCode.KEY_EXISTS_ERROR || isCurrentVersion(model)) {
                throw e;
            }
            log.warn("Replacing orphaned snapshot v{} for {}", model.getVersion(), model.getTenantId());
            client.put(replacePolicy, key, bins);
        }
    }

    private boolean isCurrentVersion(TenantModel model) {
        Record pointer = client.get(readPolicy, pointerKey(model.getTenantId()));
        return pointer != null && pointer.getLong("version") == model.getVersion();
    }

    private void discardOrphan(TenantModel model, Key snapshotKey, ModelPersistenceException failure) {
        try {
            client.delete(writePolicy, snapshotKey);
        } catch (AerospikeException e) {
            log.warn("Could not remove orphaned snapshot v{} for {}", model.getVersion(), model.getTenantId());
            failure.addSuppressed(e);
        }
    }

    public Optional<TenantModel> loadLatest(String tenantId) {
        Record pointer = client.get(readPolicy, pointerKey(tenantId));
        if (pointer == null) return Optional.empty();
        return load(tenantId, pointer.getLong("version"));
    }

    public Optional<TenantModel> load(String tenantId, long version) {
        Record record = client.get(readPolicy, snapshotKey(tenantId, version));
        if (record == null) return Optional.empty();

        try {
            return Optional.of(objectMapper.readValue(record.getString("modelJson"), TenantModel.class));
        } catch (JsonProcessingException e) {
            throw new ModelPersistenceException("Corrupt model v" + version + " for " + tenantId, e);
        }
    }

    public Optional<Map<String, Object>> getModelMetadata(String tenantId) {
        Record pointer = client.get(readPolicy, pointerKey(tenantId));
        if (pointer == null) return Optional.empty();

        long version = pointer.getLong("version");
        Record record = client.get(readPolicy, snapshotKey(tenantId, version));
        if (record == null) return Optional.empty();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("tenantId", tenantId);
        metadata.put("version", version);
        metadata.put("treeCount", record.getInt("treeCount"));
        metadata.put("trainingSamples", record.getInt("trainSamples"));
        metadata.put("trainedAt", record.getLong("trainedAt"));
        return Optional.of(metadata);
    }

    private Key snapshotKey(String tenantId, long version) {
        return new Key(namespace, AerospikeConfig.SET_MODEL_SNAPSHOTS, tenantId + ":v" + version);
    }

    private Key pointerKey(String tenantId) {
        return new Key(namespace, AerospikeConfig.SET_MODEL_POINTERS, tenantId);
    }
}
