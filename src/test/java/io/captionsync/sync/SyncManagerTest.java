package io.captionsync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import io.captionsync.config.SyncSettings;
import io.captionsync.error.ErrorCode;
import io.captionsync.error.SyncException;
import io.captionsync.model.ChangeRecord;
import io.captionsync.model.ChangeSet;
import io.captionsync.model.ConnectionState;
import io.captionsync.model.InstanceId;
import io.captionsync.model.LockState;
import io.captionsync.observability.SyncEventLog;
import io.captionsync.support.TestImages;
import io.captionsync.support.TestSettings;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

final class SyncManagerTest {
    private static final InstanceId LAYOUT = InstanceId.of("v1", "layout");

    @Test
    void queuesWhileDisconnectedAndDrainsOnReconnect() throws Exception {
        Path root = Files.createTempDirectory("captionsync-test-sync-backlog-");
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            FakeSyncServer server = new FakeSyncServer();
            RecordingListener listener = new RecordingListener();
            SyncManager manager = manager(root, server, scheduler, listener);
            manager.setLocalVersion(5L);
            server.setReachable(false);
            manager.connect("tkn");
            Assertions.assertNotEquals(ConnectionState.CONNECTED, manager.connectionState());

            Assertions.assertEquals(1, manager.sendChanges(changeSet(5L, 6L), 5L));
            Assertions.assertEquals(2, manager.sendChanges(changeSet(6L, 7L), 6L));
            Assertions.assertEquals(3, manager.sendChanges(changeSet(7L, 8L), 7L));
            Assertions.assertTrue(server.receivedOfType("changes").isEmpty());

            server.setReachable(true);
            awaitTrue(() -> manager.connectionState() == ConnectionState.CONNECTED);
            awaitTrue(() -> manager.pendingChanges() == 0);

            List<JsonNode> sent = server.receivedOfType("changes");
            Assertions.assertEquals(3, sent.size());
            Assertions.assertEquals(List.of(6L, 7L, 8L), sent.stream().map(n -> n.path("version").asLong()).toList());
            Assertions.assertEquals(8L, listener.lastAck);
            Assertions.assertEquals(8L, manager.localVersion());
        } finally {
            scheduler.shutdownNow();
            TestImages.deleteRecursively(root);
        }
    }

    @Test
    void unacknowledgedFramesAreResentAfterDrop() throws Exception {
        Path root = Files.createTempDirectory("captionsync-test-sync-resend-");
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            FakeSyncServer server = new FakeSyncServer();
            server.setAutoAck(false);
            RecordingListener listener = new RecordingListener();
            SyncManager manager = manager(root, server, scheduler, listener);
            manager.connect(null);
            Assertions.assertEquals(ConnectionState.CONNECTED, manager.connectionState());

            manager.sendChanges(changeSet(0L, 1L), 0L);
            String firstId = server.receivedOfType("changes").get(0).path("messageId").asText();
            server.channel(LAYOUT).drop(1006);
            Assertions.assertEquals(1, manager.pendingChanges());

            awaitTrue(() -> server.receivedOfType("changes").size() == 2);
            Assertions.assertEquals(firstId, server.receivedOfType("changes").get(1).path("messageId").asText());
            Assertions.assertTrue(listener.states.contains(ConnectionState.RECONNECTING));

            server.ackAll(LAYOUT);
            Assertions.assertEquals(0, manager.pendingChanges());
        } finally {
            scheduler.shutdownNow();
            TestImages.deleteRecursively(root);
        }
    }

    @Test
    void serverPendingCountIsAuthoritative() throws Exception {
        Path root = Files.createTempDirectory("captionsync-test-sync-pending-");
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            FakeSyncServer server = new FakeSyncServer();
            server.setAutoAck(false);
            RecordingListener listener = new RecordingListener();
            SyncManager manager = manager(root, server, scheduler, listener);
            manager.connect(null);
            manager.sendChanges(changeSet(0L, 1L), 0L);
            server.channel(LAYOUT).push("{\"type\":\"ack\",\"version\":4,\"pending\":2}");

            Assertions.assertEquals(2, manager.pendingChanges());
            Assertions.assertEquals(2, listener.lastPending);
            Assertions.assertEquals(4L, manager.localVersion());
        } finally {
            scheduler.shutdownNow();
            TestImages.deleteRecursively(root);
        }
    }

    @Test
    void versionOnlyAckConfirmsEveryFrameUpToIt() throws Exception {
        Path root = Files.createTempDirectory("captionsync-test-sync-cumulative-");
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            FakeSyncServer server = new FakeSyncServer();
            server.setAutoAck(false);
            RecordingListener listener = new RecordingListener();
            SyncManager manager = manager(root, server, scheduler, listener);
            manager.setLocalVersion(5L);
            manager.connect(null);
            manager.sendChanges(changeSet(5L, 6L), 5L);
            manager.sendChanges(changeSet(6L, 7L), 6L);
            manager.sendChanges(changeSet(7L, 8L), 7L);
            FakeSyncServer.Channel channel = server.channel(LAYOUT);

            channel.push("{\"type\":\"ack\",\"version\":7}");
            Assertions.assertEquals(1, manager.pendingChanges());
            Assertions.assertEquals(1, listener.lastPending);

            channel.push("{\"type\":\"ack\",\"version\":8}");
            Assertions.assertEquals(0, manager.pendingChanges());
            Assertions.assertEquals(8L, manager.localVersion());
        } finally {
            scheduler.shutdownNow();
            TestImages.deleteRecursively(root);
        }
    }

    @Test
    void repeatedAckLeavesOtherFramesPending() throws Exception {
        Path root = Files.createTempDirectory("captionsync-test-sync-duplicate-ack-");
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            FakeSyncServer server = new FakeSyncServer();
            server.setAutoAck(false);
            RecordingListener listener = new RecordingListener();
            SyncManager manager = manager(root, server, scheduler, listener);
            manager.connect(null);
            manager.sendChanges(changeSet(0L, 1L), 0L);
            manager.sendChanges(changeSet(1L, 2L), 1L);
            String firstId = server.receivedOfType("changes").get(0).path("messageId").asText();
            String ack = "{\"type\":\"ack\",\"version\":1,\"messageId\":\"" + firstId + "\"}";
            FakeSyncServer.Channel channel = server.channel(LAYOUT);

            channel.push(ack);
            channel.push(ack);
            channel.push("{\"type\":\"ack\",\"version\":2,\"messageId\":\"never-sent\"}");
            Assertions.assertEquals(1, manager.pendingChanges());

            server.channel(LAYOUT).drop(1006);
            awaitTrue(() -> server.receivedOfType("changes").size() == 3);
            Assertions.assertNotEquals(firstId, server.receivedOfType("changes").get(2).path("messageId").asText());
            Assertions.assertTrue(Files.readString(root.resolve("events.jsonl")).contains("sync.ack_unmatched"));
        } finally {
            scheduler.shutdownNow();
            TestImages.deleteRecursively(root);
        }
    }

    @Test
    void malformedChangesFrameIsDroppedAndLaterFramesStillArrive() throws Exception {
        Path root = Files.createTempDirectory("captionsync-test-sync-malformed-");
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            FakeSyncServer server = new FakeSyncServer();
            RecordingListener listener = new RecordingListener();
            SyncManager manager = manager(root, server, scheduler, listener);
            manager.connect(null);
            FakeSyncServer.Channel channel = server.channel(LAYOUT);

            Assertions.assertDoesNotThrow(() -> channel.push("{\"type\":\"changes\",\"version\":3,\"changes\":[42]}"));
            Assertions.assertTrue(listener.remote.isEmpty());
            Assertions.assertEquals(0L, manager.localVersion());

            channel.push("{\"type\":\"changes\",\"version\":4,\"changes\":[{\"table\":\"boxes\",\"pk\":\"[1]\",\"cid\":\"x\",\"val\":1,\"col_version\":1,\"db_version\":4,\"site_id\":\"s\",\"seq\":0}]}");
            Assertions.assertEquals(1, listener.remote.size());
            Assertions.assertEquals(4L, manager.localVersion());
            Assertions.assertTrue(Files.readString(root.resolve("events.jsonl")).contains("sync.frame_invalid"));
        } finally {
            scheduler.shutdownNow();
            TestImages.deleteRecursively(root);
        }
    }

    @Test
    void inboundFramesAreDispatched() throws Exception {
        Path root = Files.createTempDirectory("captionsync-test-sync-inbound-");
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            FakeSyncServer server = new FakeSyncServer();
            RecordingListener listener = new RecordingListener();
            SyncManager manager = manager(root, server, scheduler, listener);
            manager.connect(null);
            FakeSyncServer.Channel channel = server.channel(LAYOUT);

            channel.push("{\"type\":\"changes\",\"version\":9,\"changes\":[{\"table\":\"boxes\",\"pk\":\"[1]\",\"cid\":\"label\",\"val\":\"in\",\"col_version\":2,\"db_version\":9,\"site_id\":\"s\",\"seq\":0}]}");
            channel.push("{\"type\":\"lock\",\"state\":\"transferring\",\"holder\":\"tab-b\"}");
            channel.push("{\"type\":\"session_transferred\",\"newTabId\":\"tab-c\"}");
            channel.push("{\"type\":\"error\",\"detail\":\"version conflict\"}");
            channel.push("{\"type\":\"pong\"}");
            channel.push("{\"type\":\"mystery\"}");
            channel.push("not json");

            Assertions.assertEquals(1, listener.remote.size());
            ChangeSet remote = listener.remote.get(0);
            Assertions.assertEquals(9L, remote.resultingVersion());
            Assertions.assertEquals("label", remote.records().get(0).cid());
            Assertions.assertEquals(2L, remote.records().get(0).colVersion());
            Assertions.assertEquals(9L, manager.localVersion());
            Assertions.assertEquals(List.of(LockState.TRANSFERRING), listener.lockStates);
            Assertions.assertEquals(List.of("tab-c"), listener.transfers);
            Assertions.assertEquals(1, listener.errors.size());
            Assertions.assertEquals(ErrorCode.SYNC_FAILED, listener.errors.get(0).code());
            Assertions.assertEquals(ConnectionState.CONNECTED, manager.connectionState());

            String log = Files.readString(root.resolve("events.jsonl"));
            Assertions.assertTrue(log.contains("sync.frame_unknown"));
            Assertions.assertTrue(log.contains("sync.frame_invalid"));
        } finally {
            scheduler.shutdownNow();
            TestImages.deleteRecursively(root);
        }
    }

    @Test
    void normalServerCloseDoesNotReconnect() throws Exception {
        Path root = Files.createTempDirectory("captionsync-test-sync-close-");
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            FakeSyncServer server = new FakeSyncServer();
            SyncManager manager = manager(root, server, scheduler, new RecordingListener());
            manager.connect(null);
            server.channel(LAYOUT).drop(1000);
            Thread.sleep(150L);
            Assertions.assertEquals(ConnectionState.DISCONNECTED, manager.connectionState());
            Assertions.assertEquals(1, server.opens());
        } finally {
            scheduler.shutdownNow();
            TestImages.deleteRecursively(root);
        }
    }

    @Test
    void outageIsReportedOnceAndRetriesContinue() throws Exception {
        Path root = Files.createTempDirectory("captionsync-test-sync-outage-");
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            FakeSyncServer server = new FakeSyncServer();
            server.setReachable(false);
            RecordingListener listener = new RecordingListener();
            SyncManager manager = manager(root, server, scheduler, listener);
            manager.connect(null);

            awaitTrue(() -> server.opens() >= 6);
            Assertions.assertEquals(1, listener.errors.size());
            Assertions.assertEquals(ErrorCode.WEBSOCKET_CLOSED, listener.errors.get(0).code());
            Assertions.assertEquals(ConnectionState.RECONNECTING, manager.connectionState());

            server.setReachable(true);
            awaitTrue(() -> manager.connectionState() == ConnectionState.CONNECTED);
        } finally {
            scheduler.shutdownNow();
            TestImages.deleteRecursively(root);
        }
    }

    @Test
    void disconnectClosesChannelAndStopsReconnecting() throws Exception {
        Path root = Files.createTempDirectory("captionsync-test-sync-disconnect-");
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            FakeSyncServer server = new FakeSyncServer();
            SyncManager manager = manager(root, server, scheduler, new RecordingListener());
            manager.connect(null);
            FakeSyncServer.Channel channel = server.channel(LAYOUT);
            manager.disconnect();

            Assertions.assertTrue(channel.isClosed());
            Assertions.assertEquals(1000, channel.closeCode());
            Assertions.assertEquals(ConnectionState.DISCONNECTED, manager.connectionState());
            Assertions.assertThrows(SyncException.class, () -> manager.sendChanges(changeSet(0L, 1L), 0L));

            channel.drop(1006);
            Thread.sleep(100L);
            Assertions.assertEquals(1, server.opens());
        } finally {
            scheduler.shutdownNow();
            TestImages.deleteRecursively(root);
        }
    }

    @Test
    void heartbeatSendsPings() throws Exception {
        Path root = Files.createTempDirectory("captionsync-test-sync-ping-");
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            FakeSyncServer server = new FakeSyncServer();
            SyncSettings base = TestSettings.fast();
            SyncSettings settings = new SyncSettings(base.storageBaseUrl(), base.apiBaseUrl(), base.syncBaseUrl(),
                    base.downloadMaxAttempts(), base.downloadBaseDelayMs(), base.downloadMaxDelayMs(), base.backoffMultiplier(),
                    base.downloadChunkBytes(), base.requestTimeoutMs(), base.reconnectBaseDelayMs(), base.reconnectMaxDelayMs(),
                    base.reconnectAttemptCeiling(), 20L, base.subscriptionDebounceMs(), base.initializeThreads());
            SyncManager manager = new SyncManager(LAYOUT, server, scheduler, settings, new RecordingListener(),
                    new SyncEventLog(root.resolve("events.jsonl"), "tab-test"));
            manager.connect(null);
            awaitTrue(() -> server.receivedOfType("ping").size() >= 2);
            manager.disconnect();
        } finally {
            scheduler.shutdownNow();
            TestImages.deleteRecursively(root);
        }
    }

    private static SyncManager manager(Path root, FakeSyncServer server, ScheduledExecutorService scheduler, SyncListener listener) {
        return new SyncManager(LAYOUT, server, scheduler, TestSettings.fast(), listener,
                new SyncEventLog(root.resolve("events.jsonl"), "tab-test"));
    }

    private static ChangeSet changeSet(long from, long to) {
        ChangeRecord record = new ChangeRecord("boxes", "[1]", "label", "v" + to, to, to, "site-a", 0);
        return new ChangeSet(from, to, List.of(record));
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                Assertions.fail("condition not met within 5s");
            }
            Thread.sleep(10L);
        }
    }

    private static final class RecordingListener implements SyncListener {
        final List<ChangeSet> remote = new CopyOnWriteArrayList<>();
        final List<LockState> lockStates = new CopyOnWriteArrayList<>();
        final List<String> transfers = new CopyOnWriteArrayList<>();
        final List<SyncException> errors = new CopyOnWriteArrayList<>();
        final List<ConnectionState> states = new CopyOnWriteArrayList<>();
        volatile long lastAck = -1L;
        volatile int lastPending = -1;

        @Override
        public void onRemoteChanges(ChangeSet changes) {
            remote.add(changes);
        }

        @Override
        public void onAck(long version, int pendingChanges) {
            lastAck = version;
            lastPending = pendingChanges;
        }

        @Override
        public void onLockState(LockState state, String holder) {
            lockStates.add(state);
        }

        @Override
        public void onSessionTransferred(String newTabId) {
            transfers.add(newTabId);
        }

        @Override
        public void onError(SyncException error) {
            errors.add(error);
        }

        @Override
        public void onConnectionChanged(ConnectionState state, int pendingChanges) {
            states.add(state);
        }
    }
}
