package io.captionsync.registry;

import io.captionsync.model.ChangeRecord;
import io.captionsync.model.DatabaseName;
import io.captionsync.model.InstanceId;
import io.captionsync.model.LockStatus;
import io.captionsync.model.QueryResult;

import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

/**
 * Caller-facing view of a live instance. Every call goes through the owning registry, so a handle to a closed
 * instance fails with {@code NOT_INITIALIZED} instead of touching a closed engine.
 */
public final class DatabaseHandle implements AutoCloseable {
    private final InstanceRegistry registry;
    private final InstanceId instanceId;

    DatabaseHandle(InstanceRegistry registry, InstanceId instanceId) {
        this.registry = registry;
        this.instanceId = instanceId;
    }

    public InstanceId instanceId() {
        return instanceId;
    }

    public String videoId() {
        return instanceId.videoId();
    }

    public DatabaseName databaseName() {
        return instanceId.databaseName();
    }

    public QueryResult query(String sql, Object... params) {
        return registry.query(videoId(), databaseName(), sql, Arrays.asList(params));
    }

    public int execute(String sql, Object... params) {
        return registry.execute(videoId(), databaseName(), sql, Arrays.asList(params));
    }

    public LockStatus acquireLock() {
        return registry.acquireLock(videoId(), databaseName());
    }

    public LockStatus releaseLock() {
        return registry.releaseLock(videoId(), databaseName());
    }

    public LockStatus checkLock() {
        return registry.checkLock(videoId(), databaseName());
    }

    public InstanceSnapshot snapshot() {
        return registry.snapshot(videoId(), databaseName())
                .orElseThrow(() -> InstanceRegistry.notInitialized(instanceId));
    }

    public ChangeSubscription subscribe(SubscriptionFilter filter, Consumer<List<ChangeRecord>> callback) {
        return registry.subscribe(videoId(), databaseName(), filter, callback);
    }

    public AutoCloseable watch(Consumer<InstanceSnapshot> listener) {
        return registry.watch(videoId(), databaseName(), listener);
    }

    @Override
    public void close() {
        registry.close(videoId(), databaseName());
    }
}
