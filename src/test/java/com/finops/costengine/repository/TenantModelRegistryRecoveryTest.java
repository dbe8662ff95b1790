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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.finops.costengine.config.AerospikeConfig;
import com.finops.costengine.exception.ModelPersistenceException;
import com.finops.costengine.model.TenantModel;
import com.finops.costengine.testutil.TestModels;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.when;

/**
 * Registry over the real snapshot repository, backed by an in-memory stand-in for the
 * Aerospike client that honours CREATE_ONLY and can fail individual writes.
 */
@ExtendWith(MockitoExtension.class)
class TenantModelRegistryRecoveryTest {

    private static final String NAMESPACE = "test";
    private static final Key POINTER = new Key(NAMESPACE, AerospikeConfig.SET_MODEL_POINTERS, "tenant-a");

    @Mock
    private AerospikeClient client;

    private final Map<Key, Map<String, Object>> store = new HashMap<>();
    private final AtomicInteger pointerFailures = new AtomicInteger();
    private boolean deleteFails;

    private TenantModelRegistry registry;

    @BeforeEach
    void setUp() {
        WritePolicy writePolicy = new WritePolicy();
        WritePolicy createOnlyPolicy = new WritePolicy();
        createOnlyPolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;

        doAnswer(inv -> {
            WritePolicy policy = inv.getArgument(0);
            Key key = inv.getArgument(1);
            if (key.equals(POINTER) && pointerFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new AerospikeException(ResultCode.TIMEOUT, "pointer write timed out");
            }
            if (policy.recordExistsAction == RecordExistsAction.CREATE_ONLY && store.containsKey(key)) {
                throw new AerospikeException(ResultCode.KEY_EXISTS_ERROR, "key exists");
            }
            Map<String, Object> bins = new HashMap<>();
            for (int i = 2; i < inv.getArguments().length; i++) {
                Object arg = inv.getArguments()[i];
                Bin[] written = arg instanceof Bin[] ? (Bin[]) arg : new Bin[]{(Bin) arg};
                for (Bin bin : written) {
                    bins.put(bin.name, bin.value.getObject());
                }
            }
            store.put(key, bins);
            return null;
        }).when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        when(client.get(any(Policy.class), any(Key.class))).thenAnswer(inv -> {
            Map<String, Object> bins = store.get(inv.<Key>getArgument(1));
            return bins == null ? null : new Record(bins, 1, 0);
        });

        doAnswer(inv -> {
            if (deleteFails) throw new AerospikeException(ResultCode.TIMEOUT, "delete timed out");
            return store.remove(inv.<Key>getArgument(1)) != null;
        }).when(client).delete(any(WritePolicy.class), any(Key.class));

        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        ModelSnapshotRepository repository = new ModelSnapshotRepository(
                client, NAMESPACE, writePolicy, createOnlyPolicy, new Policy(), objectMapper);
        registry = new TenantModelRegistry(repository);
    }

    @Test
    void publish_afterPointerWriteFailed_nextPublishSucceeds() {
        registry.publish(TestModels.model("tenant-a", 0));
        pointerFailures.set(1);

        assertThatThrownBy(() -> registry.publish(TestModels.model("tenant-a", 0)))
                .isInstanceOf(ModelPersistenceException.class);
        assertThat(registry.find("tenant-a").orElseThrow().getVersion()).isEqualTo(1L);

        TenantModel retried = registry.publish(TestModels.model("tenant-a", 0));

        assertThat(retried.getVersion()).isEqualTo(2L);
        assertThat(store.get(POINTER)).containsEntry("version", 2L);
    }

    @Test
    void publish_orphanedSnapshotLeftBehind_isReplacedOnRetry() {
        registry.publish(TestModels.model("tenant-a", 0));
        pointerFailures.set(1);
        deleteFails = true;

        assertThatThrownBy(() -> registry.publish(TestModels.model("tenant-a", 0)))
                .isInstanceOf(ModelPersistenceException.class)
                .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
        assertThat(store).containsKey(new Key(NAMESPACE, AerospikeConfig.SET_MODEL_SNAPSHOTS, "tenant-a:v2"));

        TenantModel retried = registry.publish(TestModels.model("tenant-a", 0));

        assertThat(retried.getVersion()).isEqualTo(2L);
        assertThat(store.get(POINTER)).containsEntry("version", 2L);
    }

    @Test
    void publish_afterRestart_continuesFromPointer() {
        registry.publish(TestModels.model("tenant-a", 0));
        pointerFailures.set(1);
        assertThatThrownBy(() -> registry.publish(TestModels.model("tenant-a", 0)))
                .isInstanceOf(ModelPersistenceException.class);

        registry.evict("tenant-a");
        TenantModel retried = registry.publish(TestModels.model("tenant-a", 0));

        assertThat(retried.getVersion()).isEqualTo(2L);
        assertThat(registry.find("tenant-a")).contains(retried);
    }
}
