package io.captionsync.registry;

import io.captionsync.config.SyncClientConfig;
import io.captionsync.config.SyncSettings;
import io.captionsync.download.DownloadRequest;
import io.captionsync.download.ImageDownloader;
import io.captionsync.engine.ChangeSetEngine;
import io.captionsync.engine.ChangeSetEngineFactory;
import io.captionsync.engine.SqliteEngineFactory;
import io.captionsync.error.CorruptImageException;
import io.captionsync.error.DatabaseException;
import io.captionsync.error.ErrorCode;
import io.captionsync.error.LockException;
import io.captionsync.error.PermissionDeniedException;
import io.captionsync.error.SyncException;
import io.captionsync.lock.HttpLockService;
import io.captionsync.lock.LockManager;
import io.captionsync.model.ChangeRecord;
import io.captionsync.model.ChangeSet;
import io.captionsync.model.ConnectionState;
import io.captionsync.model.DatabaseName;
import io.captionsync.model.DownloadProgress;
import io.captionsync.model.InstanceId;
import io.captionsync.model.LockState;
import io.captionsync.model.LockStatus;
import io.captionsync.model.QueryResult;
import io.captionsync.model.SyncStatus;
import io.captionsync.model.VersionInfo;
import io.captionsync.observability.SyncEventLog;
import io.captionsync.sync.SyncChannelFactory;
import io.captionsync.sync.SyncListener;
import io.captionsync.sync.SyncManager;
import io.captionsync.sync.WebSocketSyncChannelFactory;

import java.net.http.HttpClient;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Table of live database instances keyed by {@link InstanceId}.
 * <p>
 * Each instance is guarded by its own lock: registry calls and inbound sync frames for one instance run one at
 * a time, different instances never block each other. Initialization runs on the registry's worker pool;
 * reconnects, heartbeats and subscription debounce run on a shared scheduler.
 */
public final class InstanceRegistry implements AutoCloseable {
    private final ImageDownloader downloader;
    private final ChangeSetEngineFactory engineFactory;
    private final LockManager lockManager;
    private final SyncChannelFactory channelFactory;
    private final SyncSettings settings;
    private final SyncEventLog eventLog;
    private final InstanceMetadataStore metadataStore;
    private final ExecutorService initExecutor;
    private final ScheduledExecutorService scheduler;
    private final ConcurrentHashMap<InstanceId, DatabaseInstance> instances = new ConcurrentHashMap<>();

    public InstanceRegistry(Components components) {
        this.downloader = components.downloader();
        this.engineFactory = components.engineFactory();
        this.lockManager = components.lockManager();
        this.channelFactory = components.channelFactory();
        this.settings = components.settings();
        this.eventLog = components.eventLog();
        this.metadataStore = components.metadataStore();
        this.initExecutor = Executors.newFixedThreadPool(settings.initializeThreads(), daemonThreads("captionsync-init"));
        this.scheduler = Executors.newScheduledThreadPool(1, daemonThreads("captionsync-sync"));
    }

    /**
     * Wires the production collaborators from a client root directory and its settings file.
     */
    public static InstanceRegistry create(SyncClientConfig config) {
        SyncSettings settings = SyncSettings.load(config);
        SyncEventLog eventLog = new SyncEventLog(config.eventLogFile(), config.clientId());
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(settings.requestTimeout())
                .build();
        return new InstanceRegistry(new Components(
                new ImageDownloader(http, settings, config.cacheDir(), eventLog),
                new SqliteEngineFactory(config.workDir()),
                new LockManager(
                        new HttpLockService(http, settings.apiBaseUrl(), config.clientId(), settings.requestTimeout()),
                        config.clientId(),
                        eventLog),
                new WebSocketSyncChannelFactory(http, settings.syncBaseUrl(), config.clientId(), settings.requestTimeout()),
                settings,
                eventLog,
                new InstanceMetadataStore(config.metadataFile())
        ));
    }

    public CompletableFuture<DatabaseHandle> initialize(String tenantId, String videoId, DatabaseName databaseName) {
        return initialize(tenantId, videoId, databaseName, InitializeOptions.defaults());
    }

    /**
     * Returns the handle of the instance, starting its initialization if nothing live exists for the key.
     * Concurrent callers for the same key share one initialization. A record whose initialization failed is
     * replaced by a fresh attempt.
     */
    public CompletableFuture<DatabaseHandle> initialize(
            String tenantId,
            String videoId,
            DatabaseName databaseName,
            InitializeOptions options
    ) {
        InstanceId id = new InstanceId(videoId, databaseName);
        InitializeOptions opts = options == null ? InitializeOptions.defaults() : options;
        DatabaseInstance[] created = new DatabaseInstance[1];
        DatabaseInstance instance = instances.compute(id, (key, existing) -> {
            if (existing != null && !failed(existing)) {
                return existing;
            }
            created[0] = new DatabaseInstance(key);
            return created[0];
        });
        if (created[0] != null) {
            eventLog.log("instance.initialize", id, "started", Map.of(
                    "acquire_lock", opts.acquireLock(),
                    "force_download", opts.forceDownload()
            ));
            try {
                initExecutor.execute(() -> runInitialize(instance, tenantId, opts));
            } catch (RuntimeException e) {
                instances.remove(id, instance);
                instance.ready().completeExceptionally(DatabaseException.wrap(e, ErrorCode.DATABASE_INIT_FAILED, id));
            }
        }
        return instance.ready().copy();
    }

    private static boolean failed(DatabaseInstance instance) {
        instance.lock();
        try {
            return instance.hasFailed();
        } finally {
            instance.unlock();
        }
    }

    private void runInitialize(DatabaseInstance instance, String tenantId, InitializeOptions options) {
        InstanceId id = instance.instanceId();
        ChangeSetEngine engine = null;
        boolean installed = false;
        try {
            byte[] image = downloader.download(
                    new DownloadRequest(tenantId, id, options.forceDownload(), options.authToken()),
                    progress -> onProgress(instance, progress, options),
                    instance.cancel());
            instance.cancel().throwIfCancelled("Initialization of " + id);
            try {
                engine = engineFactory.open(id, image);
            } catch (CorruptImageException e) {
                downloader.clearCache(tenantId, id);
                throw e;
            }
            downloader.cacheImage(tenantId, id, image);
            VersionInfo info = engine.getVersionInfo();
            SyncManager sync = new SyncManager(id, channelFactory, scheduler, settings, new InstanceSyncListener(instance), eventLog);

            instance.lock();
            try {
                if (!instance.isClosed() && instances.get(id) == instance) {
                    instance.markReady(engine, info.version(), sync, options.authToken(), Instant.now());
                    installed = true;
                }
            } finally {
                instance.unlock();
            }
            if (!installed) {
                throw new CancellationException("Initialization of " + id + " cancelled");
            }
            eventLog.log("instance.ready", id, "ok", Map.of("version", info.version(), "site_id", info.siteId()));
            notifyWatchers(instance);

            sync.setLocalVersion(info.version());
            sync.connect(options.authToken());
            if (options.acquireLock()) {
                acquireOnInitialize(instance, options.authToken());
            }
            instance.ready().complete(new DatabaseHandle(this, id));
        } catch (CancellationException e) {
            if (!installed) {
                closeQuietly(engine, id);
            }
            instance.ready().completeExceptionally(new DatabaseException(ErrorCode.NOT_INITIALIZED,
                    "Instance " + id + " was closed during initialization", id, e));
            eventLog.log("instance.initialize", id, "cancelled", Map.of());
        } catch (RuntimeException e) {
            if (!installed) {
                closeQuietly(engine, id);
            }
            DatabaseException failure = DatabaseException.wrap(e, ErrorCode.DATABASE_INIT_FAILED, id);
            instance.lock();
            try {
                if (!installed) {
                    instance.markFailed(failure);
                } else {
                    instance.error(failure);
                }
            } finally {
                instance.unlock();
            }
            eventLog.log("instance.initialize", id, "failed", failure.toDetails());
            notifyWatchers(instance);
            instance.ready().completeExceptionally(failure);
        }
    }

    private void onProgress(DatabaseInstance instance, DownloadProgress progress, InitializeOptions options) {
        instance.lock();
        try {
            instance.downloadProgress(progress);
        } finally {
            instance.unlock();
        }
        if (options.onProgress() != null) {
            try {
                options.onProgress().accept(progress);
            } catch (RuntimeException e) {
                eventLog.log("download.progress_callback_failed", instance.instanceId(), "contained",
                        Map.of("error", e.getClass().getSimpleName() + ": " + e.getMessage()));
            }
        }
        notifyWatchers(instance);
    }

    /**
     * Lock failures leave the instance open read-only.
     */
    private void acquireOnInitialize(DatabaseInstance instance, String token) {
        InstanceId id = instance.instanceId();
        try {
            lockManager.acquire(id, token);
        } catch (LockException e) {
            eventLog.log("instance.lock_degraded", id, "read_only", e.toDetails());
            try {
                lockManager.check(id, token);
            } catch (DatabaseException checkError) {
                eventLog.log("instance.lock_check", id, "error", checkError.toDetails());
            }
        }
        storeLockStatus(instance);
    }

    public QueryResult query(String videoId, DatabaseName databaseName, String sql, List<?> params) {
        DatabaseInstance instance = requireReady(videoId, databaseName);
        instance.lock();
        try {
            requireReady(instance);
            return instance.engine().query(sql, params);
        } finally {
            instance.unlock();
        }
    }

    /**
     * Runs a mutating statement. Requires the edit lock; the engine is never reached without it. Produced changes
     * are handed to the sync channel. A statement or sync failure is recorded on the instance before it is thrown.
     */
    public int execute(String videoId, DatabaseName databaseName, String sql, List<?> params) {
        DatabaseInstance instance = requireReady(videoId, databaseName);
        InstanceId id = instance.instanceId();
        int affected = 0;
        DatabaseException failure = null;
        instance.lock();
        try {
            requireReady(instance);
            LockStatus lock = instance.lockStatus() == null ? LockStatus.released() : instance.lockStatus();
            if (!lock.canEdit()) {
                throw new PermissionDeniedException(id, lock);
            }
            try {
                ChangeSetEngine engine = instance.engine();
                long before = engine.getVersionInfo().version();
                affected = engine.exec(sql, params);
                long after = engine.getVersionInfo().version();
                if (after > before) {
                    ChangeSet changes = engine.getChangesSince(before);
                    instance.advanceVersion(after);
                    instance.syncStatus(instance.syncStatus().withSyncing(true));
                    int pending = instance.sync().sendChanges(changes, before);
                    SyncStatus status = instance.syncStatus().withPendingChanges(pending);
                    instance.syncStatus(pending == 0 ? status.withSyncing(false) : status);
                }
            } catch (DatabaseException e) {
                instance.error(e);
                failure = e;
            }
        } finally {
            instance.unlock();
        }
        if (failure != null) {
            eventLog.log("instance.execute", id, "failed", failure.toDetails());
        }
        notifyWatchers(instance);
        if (failure != null) {
            throw failure;
        }
        return affected;
    }

    public LockStatus acquireLock(String videoId, DatabaseName databaseName) {
        DatabaseInstance instance = requireReady(videoId, databaseName);
        lockManager.acquire(instance.instanceId(), token(instance));
        return storeLockStatus(instance);
    }

    public LockStatus releaseLock(String videoId, DatabaseName databaseName) {
        DatabaseInstance instance = requireReady(videoId, databaseName);
        lockManager.release(instance.instanceId(), token(instance));
        return storeLockStatus(instance);
    }

    public LockStatus checkLock(String videoId, DatabaseName databaseName) {
        DatabaseInstance instance = requireReady(videoId, databaseName);
        lockManager.check(instance.instanceId(), token(instance));
        return storeLockStatus(instance);
    }

    /**
     * Copies the lock manager's current view onto the instance. Server-pushed transitions that landed while a
     * lock request was in flight win because the lock manager already holds them.
     */
    private LockStatus storeLockStatus(DatabaseInstance instance) {
        LockStatus current;
        instance.lock();
        try {
            current = lockManager.status(instance.instanceId());
            if (!instance.isClosed()) {
                instance.lockStatus(current);
            }
        } finally {
            instance.unlock();
        }
        notifyWatchers(instance);
        return current;
    }

    public ChangeSubscription subscribe(
            String videoId,
            DatabaseName databaseName,
            SubscriptionFilter filter,
            Consumer<List<ChangeRecord>> callback
    ) {
        return subscribe(videoId, databaseName, filter, settings.subscriptionDebounceMs(), callback);
    }

    public ChangeSubscription subscribe(
            String videoId,
            DatabaseName databaseName,
            SubscriptionFilter filter,
            long debounceMs,
            Consumer<List<ChangeRecord>> callback
    ) {
        DatabaseInstance instance = requireRegistered(videoId, databaseName);
        ChangeSubscription subscription = new ChangeSubscription(instance.instanceId(), filter, debounceMs, callback,
                scheduler, eventLog, closed -> instance.subscriptions().remove(closed));
        instance.subscriptions().add(subscription);
        return subscription;
    }

    /**
     * Registers a listener for state snapshots. The current snapshot is delivered immediately.
     */
    public AutoCloseable watch(String videoId, DatabaseName databaseName, Consumer<InstanceSnapshot> listener) {
        DatabaseInstance instance = requireRegistered(videoId, databaseName);
        instance.watchers().add(listener);
        deliverSnapshot(instance, listener, snapshotOf(instance));
        return () -> instance.watchers().remove(listener);
    }

    public Optional<InstanceSnapshot> snapshot(String videoId, DatabaseName databaseName) {
        DatabaseInstance instance = instances.get(new InstanceId(videoId, databaseName));
        return instance == null ? Optional.empty() : Optional.of(snapshotOf(instance));
    }

    public List<InstanceSnapshot> snapshots() {
        List<InstanceSnapshot> out = new ArrayList<>();
        for (DatabaseInstance instance : instances.values()) {
            out.add(snapshotOf(instance));
        }
        out.sort(Comparator.comparing(s -> s.instanceId().value()));
        return out;
    }

    public int instanceCount() {
        return instances.size();
    }

    /**
     * Writes (instanceId, version, initializedAt) of every ready instance.
     */
    public List<InstanceMetadataStore.Entry> persistMetadata() {
        List<InstanceMetadataStore.Entry> entries = new ArrayList<>();
        for (InstanceSnapshot snapshot : snapshots()) {
            if (snapshot.ready()) {
                entries.add(new InstanceMetadataStore.Entry(
                        snapshot.instanceId().value(), snapshot.version(), snapshot.initializedAt()));
            }
        }
        metadataStore.save(entries);
        eventLog.log("metadata.persist", null, "ok", Map.of("instances", entries.size(), "file", metadataStore.file().toString()));
        return entries;
    }

    /**
     * Re-initializes every instance listed in the metadata file. Entries that no longer parse are skipped.
     */
    public List<CompletableFuture<DatabaseHandle>> restore(String tenantId, InitializeOptions options) {
        List<CompletableFuture<DatabaseHandle>> out = new ArrayList<>();
        for (InstanceMetadataStore.Entry entry : metadataStore.load()) {
            InstanceId id;
            try {
                id = InstanceId.parse(entry.instanceId());
            } catch (IllegalArgumentException e) {
                eventLog.log("metadata.restore", null, "skipped", Map.of(
                        "instance_id", String.valueOf(entry.instanceId()),
                        "error", String.valueOf(e.getMessage())));
                continue;
            }
            out.add(initialize(tenantId, id.videoId(), id.databaseName(), options));
        }
        eventLog.log("metadata.restore", null, "ok", Map.of("instances", out.size()));
        return out;
    }

    /**
     * Releases the lock if held, aborts a running initialization, stops sync and closes the engine.
     * Returns false when nothing was registered for the key.
     */
    public boolean close(String videoId, DatabaseName databaseName) {
        InstanceId id = new InstanceId(videoId, databaseName);
        DatabaseInstance instance = instances.remove(id);
        if (instance == null) {
            return false;
        }
        instance.cancel().cancel();
        ChangeSetEngine engine;
        SyncManager sync;
        String token;
        instance.lock();
        try {
            instance.markClosed();
            engine = instance.engine();
            sync = instance.sync();
            token = instance.authToken();
        } finally {
            instance.unlock();
        }
        if (lockManager.status(id).canEdit()) {
            try {
                lockManager.release(id, token);
            } catch (DatabaseException e) {
                eventLog.log("instance.close", id, "lock_release_failed", e.toDetails());
            }
        }
        lockManager.forget(id);
        if (sync != null) {
            sync.disconnect();
        }
        for (ChangeSubscription subscription : new ArrayList<>(instance.subscriptions())) {
            subscription.close();
        }
        instance.watchers().clear();
        closeQuietly(engine, id);
        instance.ready().completeExceptionally(new DatabaseException(ErrorCode.NOT_INITIALIZED,
                "Instance " + id + " was closed", id, null));
        eventLog.log("instance.close", id, "closed", Map.of());
        return true;
    }

    public int closeAll() {
        int closed = 0;
        for (InstanceId id : new ArrayList<>(instances.keySet())) {
            if (close(id.videoId(), id.databaseName())) {
                closed++;
            }
        }
        return closed;
    }

    @Override
    public void close() {
        closeAll();
        initExecutor.shutdownNow();
        scheduler.shutdownNow();
        try {
            initExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static DatabaseException notInitialized(InstanceId id) {
        return new DatabaseException(ErrorCode.NOT_INITIALIZED, "Instance " + id + " is not initialized", id, null);
    }

    private DatabaseInstance requireRegistered(String videoId, DatabaseName databaseName) {
        InstanceId id = new InstanceId(videoId, databaseName);
        DatabaseInstance instance = instances.get(id);
        if (instance == null) {
            throw notInitialized(id);
        }
        return instance;
    }

    private DatabaseInstance requireReady(String videoId, DatabaseName databaseName) {
        DatabaseInstance instance = requireRegistered(videoId, databaseName);
        instance.lock();
        try {
            requireReady(instance);
        } finally {
            instance.unlock();
        }
        return instance;
    }

    private static void requireReady(DatabaseInstance instance) {
        if (!instance.isReady()) {
            throw notInitialized(instance.instanceId());
        }
    }

    private static String token(DatabaseInstance instance) {
        instance.lock();
        try {
            return instance.authToken();
        } finally {
            instance.unlock();
        }
    }

    private static InstanceSnapshot snapshotOf(DatabaseInstance instance) {
        instance.lock();
        try {
            return instance.snapshot();
        } finally {
            instance.unlock();
        }
    }

    private void notifyWatchers(DatabaseInstance instance) {
        if (instance.watchers().isEmpty()) {
            return;
        }
        InstanceSnapshot snapshot = snapshotOf(instance);
        for (Consumer<InstanceSnapshot> watcher : instance.watchers()) {
            deliverSnapshot(instance, watcher, snapshot);
        }
    }

    private void deliverSnapshot(DatabaseInstance instance, Consumer<InstanceSnapshot> watcher, InstanceSnapshot snapshot) {
        try {
            watcher.accept(snapshot);
        } catch (RuntimeException e) {
            eventLog.log("instance.watch_failed", instance.instanceId(), "contained",
                    Map.of("error", e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }

    private void closeQuietly(ChangeSetEngine engine, InstanceId id) {
        if (engine == null) {
            return;
        }
        try {
            engine.close();
        } catch (RuntimeException e) {
            eventLog.log("instance.engine_close", id, "error", Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Applies inbound sync traffic to one instance. Every callback takes the instance lock, so frames and local
     * calls for the instance never interleave.
     */
    private final class InstanceSyncListener implements SyncListener {
        private final DatabaseInstance instance;

        private InstanceSyncListener(DatabaseInstance instance) {
            this.instance = instance;
        }

        @Override
        public void onRemoteChanges(ChangeSet changes) {
            InstanceId id = instance.instanceId();
            List<ChangeSubscription> targets;
            instance.lock();
            try {
                if (!instance.isReady()) {
                    return;
                }
                long version;
                try {
                    version = instance.engine().applyChanges(changes);
                } catch (DatabaseException e) {
                    instance.error(e);
                    eventLog.log("sync.apply", id, "failed", e.toDetails());
                    return;
                }
                instance.advanceVersion(version);
                instance.sync().setLocalVersion(version);
                instance.syncStatus(instance.syncStatus().withSyncing(false).withLastSyncTime(Instant.now()));
                targets = new ArrayList<>(instance.subscriptions());
            } finally {
                instance.unlock();
            }
            for (ChangeSubscription subscription : targets) {
                subscription.offer(changes.records());
            }
            notifyWatchers(instance);
        }

        @Override
        public void onAck(long version, int pendingChanges) {
            instance.lock();
            try {
                if (!instance.isReady()) {
                    return;
                }
                if (version > instance.version()) {
                    instance.engine().observeVersion(version);
                    instance.advanceVersion(version);
                }
                instance.syncStatus(instance.syncStatus()
                        .withPendingChanges(pendingChanges)
                        .withSyncing(pendingChanges > 0)
                        .withLastSyncTime(Instant.now()));
            } finally {
                instance.unlock();
            }
            notifyWatchers(instance);
        }

        @Override
        public void onLockState(LockState state, String holder) {
            instance.lock();
            try {
                if (instance.isClosed()) {
                    return;
                }
                instance.lockStatus(lockManager.applyServerState(instance.instanceId(), state, holder));
            } finally {
                instance.unlock();
            }
            notifyWatchers(instance);
        }

        @Override
        public void onSessionTransferred(String newTabId) {
            instance.lock();
            try {
                if (instance.isClosed()) {
                    return;
                }
                instance.lockStatus(lockManager.markSessionTransferred(instance.instanceId(), newTabId));
            } finally {
                instance.unlock();
            }
            notifyWatchers(instance);
        }

        @Override
        public void onError(SyncException error) {
            instance.lock();
            try {
                if (instance.isClosed()) {
                    return;
                }
                instance.error(error);
            } finally {
                instance.unlock();
            }
            eventLog.log("sync.error", instance.instanceId(), "recorded", error.toDetails());
            notifyWatchers(instance);
        }

        @Override
        public void onConnectionChanged(ConnectionState state, int pendingChanges) {
            instance.lock();
            try {
                if (instance.isClosed()) {
                    return;
                }
                SyncStatus next = instance.syncStatus()
                        .withConnectionState(state)
                        .withPendingChanges(pendingChanges);
                instance.syncStatus(next);
            } finally {
                instance.unlock();
            }
            notifyWatchers(instance);
        }
    }

    /**
     * Collaborators of a registry. Tests substitute fakes for the network-facing ones.
     */
    public record Components(
            ImageDownloader downloader,
            ChangeSetEngineFactory engineFactory,
            LockManager lockManager,
            SyncChannelFactory channelFactory,
            SyncSettings settings,
            SyncEventLog eventLog,
            InstanceMetadataStore metadataStore
    ) {
    }
}
