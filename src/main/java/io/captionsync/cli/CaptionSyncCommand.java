package io.captionsync.cli;

import io.captionsync.config.SyncClientConfig;
import io.captionsync.download.ImageDownloader;
import io.captionsync.engine.SqliteChangeSetEngine;
import io.captionsync.error.DatabaseException;
import io.captionsync.model.ChangeSet;
import io.captionsync.model.DatabaseName;
import io.captionsync.model.InstanceId;
import io.captionsync.model.QueryResult;
import io.captionsync.model.VersionInfo;
import io.captionsync.registry.DatabaseHandle;
import io.captionsync.registry.InitializeOptions;
import io.captionsync.registry.InstanceRegistry;
import io.captionsync.registry.InstanceSnapshot;
import io.captionsync.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Command(
        name = "captionsync",
        mixinStandardHelpOptions = true,
        description = "Operator commands for caption/layout database replicas",
        subcommands = {
                CaptionSyncCommand.InspectCommand.class,
                CaptionSyncCommand.ChangesCommand.class,
                CaptionSyncCommand.QueryCommand.class,
                CaptionSyncCommand.ExecCommand.class
        }
)
public final class CaptionSyncCommand implements Runnable {

    @Option(names = {"--root"}, description = "Client data root directory", defaultValue = SyncClientConfig.DEFAULT_ROOT)
    String root;

    @Option(names = {"--client-id"}, description = "Client identity used for locks and sync (random when omitted)")
    String clientId;

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().getOut().println("Use subcommands: inspect | changes | query | exec");
    }

    SyncClientConfig config() {
        return SyncClientConfig.fromRoot(root, clientId);
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    int fail(DatabaseException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.toDetails());
        out().println(Jsons.toJson(body));
        return 1;
    }

    /**
     * Opens a local image file (plain or gzip) with change tracking, outside any registry.
     */
    SqliteChangeSetEngine openLocal(Path image, String videoId, String databaseName) throws IOException {
        InstanceId id = InstanceId.of(videoId, databaseName);
        byte[] bytes = Files.readAllBytes(image);
        if (ImageDownloader.isGzip(bytes)) {
            bytes = ImageDownloader.gunzip(bytes, id, 0);
        }
        return SqliteChangeSetEngine.open(id, bytes, config().workDir());
    }

    static List<Object> params(List<String> raw) {
        return raw == null ? List.of() : new ArrayList<>(raw);
    }

    @Command(name = "inspect", description = "Print version, replicated tables and change count of a local image")
    static final class InspectCommand implements Callable<Integer> {
        @ParentCommand
        CaptionSyncCommand parent;

        @Option(names = {"--image"}, required = true, description = "Image file (.db or .db.gz)")
        Path image;

        @Option(names = {"--video"}, defaultValue = "local", description = "Video id to open the image under")
        String videoId;

        @Option(names = {"--db"}, defaultValue = "layout", description = "Database name: layout|captions")
        String databaseName;

        @Override
        public Integer call() throws IOException {
            try (SqliteChangeSetEngine engine = parent.openLocal(image, videoId, databaseName)) {
                VersionInfo info = engine.getVersionInfo();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("instance_id", engine.instanceId().value());
                out.put("version", info.version());
                out.put("site_id", info.siteId());
                out.put("replicated_tables", engine.replicatedTables());
                out.put("changes", engine.getChangesSince(0L).size());
                parent.out().println(Jsons.toJson(out));
                return 0;
            } catch (DatabaseException e) {
                return parent.fail(e);
            }
        }
    }

    @Command(name = "changes", description = "Print change records of a local image newer than a version")
    static final class ChangesCommand implements Callable<Integer> {
        @ParentCommand
        CaptionSyncCommand parent;

        @Option(names = {"--image"}, required = true, description = "Image file (.db or .db.gz)")
        Path image;

        @Option(names = {"--since"}, defaultValue = "0", description = "Exclusive lower version bound")
        long since;

        @Option(names = {"--video"}, defaultValue = "local", description = "Video id to open the image under")
        String videoId;

        @Option(names = {"--db"}, defaultValue = "layout", description = "Database name: layout|captions")
        String databaseName;

        @Override
        public Integer call() throws IOException {
            try (SqliteChangeSetEngine engine = parent.openLocal(image, videoId, databaseName)) {
                ChangeSet changes = engine.getChangesSince(since);
                parent.out().println(Jsons.toJson(changes));
                return 0;
            } catch (DatabaseException e) {
                return parent.fail(e);
            }
        }
    }

    @Command(name = "query", description = "Initialize a replica from remote storage, run a read-only query and close")
    static final class QueryCommand implements Callable<Integer> {
        @ParentCommand
        CaptionSyncCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenantId;

        @Option(names = {"--video"}, required = true, description = "Video id")
        String videoId;

        @Option(names = {"--db"}, defaultValue = "layout", description = "Database name: layout|captions")
        String databaseName;

        @Option(names = {"--token"}, description = "Bearer token for storage and sync")
        String token;

        @Option(names = {"--timeout-ms"}, defaultValue = "60000", description = "Initialization timeout")
        long timeoutMs;

        @Parameters(index = "0", description = "SQL statement")
        String sql;

        @Parameters(index = "1..*", description = "Positional statement parameters")
        List<String> args;

        @Override
        public Integer call() throws Exception {
            try (InstanceRegistry registry = InstanceRegistry.create(parent.config())) {
                DatabaseHandle handle = open(registry, tenantId, videoId, databaseName,
                        new InitializeOptions(false, false, token, null), timeoutMs);
                QueryResult result = handle.query(sql, params(args).toArray());
                parent.out().println(Jsons.toJson(result));
                return 0;
            } catch (DatabaseException e) {
                return parent.fail(e);
            }
        }
    }

    @Command(name = "exec", description = "Initialize a replica with the edit lock, run a statement and wait for the ack")
    static final class ExecCommand implements Callable<Integer> {
        @ParentCommand
        CaptionSyncCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenantId;

        @Option(names = {"--video"}, required = true, description = "Video id")
        String videoId;

        @Option(names = {"--db"}, defaultValue = "layout", description = "Database name: layout|captions")
        String databaseName;

        @Option(names = {"--token"}, description = "Bearer token for storage, lock and sync")
        String token;

        @Option(names = {"--timeout-ms"}, defaultValue = "60000", description = "Initialization and ack timeout")
        long timeoutMs;

        @Parameters(index = "0", description = "SQL statement")
        String sql;

        @Parameters(index = "1..*", description = "Positional statement parameters")
        List<String> args;

        @Override
        public Integer call() throws Exception {
            try (InstanceRegistry registry = InstanceRegistry.create(parent.config())) {
                DatabaseHandle handle = open(registry, tenantId, videoId, databaseName,
                        new InitializeOptions(true, false, token, null), timeoutMs);
                int affected = handle.execute(sql, params(args).toArray());
                InstanceSnapshot snapshot = awaitAck(handle, timeoutMs);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("affected_rows", affected);
                out.put("version", snapshot.version());
                out.put("pending_changes", snapshot.syncStatus().pendingChanges());
                out.put("acknowledged", snapshot.syncStatus().pendingChanges() == 0);
                parent.out().println(Jsons.toJson(out));
                return snapshot.syncStatus().pendingChanges() == 0 ? 0 : 3;
            } catch (DatabaseException e) {
                return parent.fail(e);
            }
        }

        private static InstanceSnapshot awaitAck(DatabaseHandle handle, long timeoutMs) throws InterruptedException {
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
            InstanceSnapshot snapshot = handle.snapshot();
            while (snapshot.syncStatus().pendingChanges() > 0 && System.nanoTime() < deadline) {
                Thread.sleep(50L);
                snapshot = handle.snapshot();
            }
            return snapshot;
        }
    }

    static DatabaseHandle open(
            InstanceRegistry registry,
            String tenantId,
            String videoId,
            String databaseName,
            InitializeOptions options,
            long timeoutMs
    ) throws InterruptedException, TimeoutException {
        try {
            return registry.initialize(tenantId, videoId, DatabaseName.fromString(databaseName), options)
                    .get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof DatabaseException typed) {
                throw typed;
            }
            throw new RuntimeException("Failed to initialize " + videoId + ":" + databaseName, cause);
        }
    }
}
