package io.captionsync.registry;

import io.captionsync.engine.ChangeSetEngine;
import io.captionsync.error.DatabaseException;
import io.captionsync.model.DownloadProgress;
import io.captionsync.model.InstanceId;
import io.captionsync.model.LockStatus;
import io.captionsync.model.SyncStatus;
import io.captionsync.sync.SyncManager;
import io.captionsync.util.CancelToken;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Mutable registry record for one instance. Fields are read and written only while {@link #lock()} is held;
 * the subscriber lists are safe to iterate without it.
 */
final class DatabaseInstance {
    private final InstanceId instanceId;
    private final ReentrantLock lock = new ReentrantLock();
    private final CompletableFuture<DatabaseHandle> ready = new CompletableFuture<>();
    private final CancelToken cancel = new CancelToken();
    private final List<ChangeSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final List<Consumer<InstanceSnapshot>> watchers = new CopyOnWriteArrayList<>();

    private ChangeSetEngine engine;
    private SyncManager sync;
    private boolean isReady;
    private boolean closed;
    private long version;
    private SyncStatus syncStatus = SyncStatus.initial();
    private LockStatus lockStatus;
    private DownloadProgress downloadProgress;
    private DatabaseException error;
    private Instant initializedAt;
    private String authToken;

    DatabaseInstance(InstanceId instanceId) {
        this.instanceId = instanceId;
    }

    InstanceId instanceId() {
        return instanceId;
    }

    void lock() {
        lock.lock();
    }

    void unlock() {
        lock.unlock();
    }

    CompletableFuture<DatabaseHandle> ready() {
        return ready;
    }

    CancelToken cancel() {
        return cancel;
    }

    List<ChangeSubscription> subscriptions() {
        return subscriptions;
    }

    List<Consumer<InstanceSnapshot>> watchers() {
        return watchers;
    }

    void markReady(ChangeSetEngine openedEngine, long openedVersion, SyncManager syncManager, String token, Instant at) {
        engine = openedEngine;
        sync = syncManager;
        version = openedVersion;
        authToken = token;
        initializedAt = at;
        error = null;
        isReady = true;
    }

    /**
     * Terminal failure before the instance became ready.
     */
    void markFailed(DatabaseException failure) {
        isReady = false;
        error = failure;
    }

    void markClosed() {
        closed = true;
        isReady = false;
    }

    boolean isReady() {
        return isReady && !closed;
    }

    boolean isClosed() {
        return closed;
    }

    boolean hasFailed() {
        return !isReady && error != null && ready.isDone();
    }

    ChangeSetEngine engine() {
        return engine;
    }

    SyncManager sync() {
        return sync;
    }

    long version() {
        return version;
    }

    void advanceVersion(long candidate) {
        version = Math.max(version, candidate);
    }

    SyncStatus syncStatus() {
        return syncStatus;
    }

    void syncStatus(SyncStatus status) {
        syncStatus = status;
    }

    LockStatus lockStatus() {
        return lockStatus;
    }

    void lockStatus(LockStatus status) {
        lockStatus = status;
    }

    void downloadProgress(DownloadProgress progress) {
        downloadProgress = progress;
    }

    void error(DatabaseException failure) {
        error = failure;
    }

    String authToken() {
        return authToken;
    }

    Instant initializedAt() {
        return initializedAt;
    }

    InstanceSnapshot snapshot() {
        return new InstanceSnapshot(
                instanceId,
                isReady(),
                version,
                syncStatus,
                lockStatus == null ? LockStatus.released() : lockStatus,
                downloadProgress,
                error,
                initializedAt
        );
    }
}
