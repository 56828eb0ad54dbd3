package io.captionsync.lock;

import io.captionsync.error.LockException;
import io.captionsync.model.InstanceId;
import io.captionsync.model.LockState;
import io.captionsync.model.LockStatus;
import io.captionsync.observability.SyncEventLog;
import io.captionsync.support.TestImages;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

final class LockManagerTest {
    private static final InstanceId LAYOUT = InstanceId.of("v1", "layout");

    @Test
    void grantDenialAndRelease() throws Exception {
        Path root = Files.createTempDirectory("captionsync-test-lock-");
        try {
            FakeLockService server = new FakeLockService();
            SyncEventLog log = new SyncEventLog(root.resolve("events.jsonl"), "test");
            LockManager a = new LockManager(server.clientView("tab-a"), "tab-a", log);
            LockManager b = new LockManager(server.clientView("tab-b"), "tab-b", log);

            LockStatus granted = a.acquire(LAYOUT, null);
            Assertions.assertEquals(LockState.GRANTED, granted.state());
            Assertions.assertTrue(granted.canEdit());

            int before = server.calls();
            Assertions.assertSame(granted, a.acquire(LAYOUT, null));
            Assertions.assertEquals(before, server.calls());

            LockStatus denied = b.acquire(LAYOUT, null);
            Assertions.assertEquals(LockState.RELEASED, denied.state());
            Assertions.assertEquals("tab-a", denied.holder());
            Assertions.assertFalse(denied.canEdit());

            Assertions.assertEquals(LockState.RELEASED, a.release(LAYOUT, null).state());
            Assertions.assertNull(server.holder(LAYOUT));
            Assertions.assertEquals(LockState.RELEASED, a.release(LAYOUT, null).state());

            LockStatus checked = b.check(LAYOUT, null);
            Assertions.assertEquals(LockState.RELEASED, checked.state());
            Assertions.assertTrue(b.acquire(LAYOUT, null).canEdit());
        } finally {
            TestImages.deleteRecursively(root);
        }
    }

    @Test
    void serverPushedTransferRevokesEditingImmediately() throws Exception {
        Path root = Files.createTempDirectory("captionsync-test-lock-push-");
        try {
            FakeLockService server = new FakeLockService();
            LockManager a = new LockManager(server.clientView("tab-a"), "tab-a", new SyncEventLog(root.resolve("e.jsonl"), "test"));
            a.acquire(LAYOUT, null);

            LockStatus transferring = a.applyServerState(LAYOUT, LockState.TRANSFERRING, "tab-a");
            Assertions.assertFalse(transferring.canEdit());
            Assertions.assertFalse(a.status(LAYOUT).canEdit());

            LockStatus moved = a.markSessionTransferred(LAYOUT, "tab-a2");
            Assertions.assertEquals(LockState.TRANSFERRING, moved.state());
            Assertions.assertEquals("tab-a2", moved.holder());

            LockStatus regranted = a.applyServerState(LAYOUT, LockState.GRANTED, "tab-a");
            Assertions.assertTrue(regranted.canEdit());
        } finally {
            TestImages.deleteRecursively(root);
        }
    }

    @Test
    void transitionPushedDuringAcquireIsKept() throws Exception {
        Path root = Files.createTempDirectory("captionsync-test-lock-race-");
        try {
            AtomicReference<LockManager> self = new AtomicReference<>();
            LockService racing = new LockService() {
                @Override
                public LockStatus acquire(InstanceId instanceId, String authToken) {
                    self.get().applyServerState(instanceId, LockState.TRANSFERRING, "tab-b");
                    return new LockStatus(LockState.GRANTED, "tab-a", true);
                }

                @Override
                public LockStatus release(InstanceId instanceId, String authToken) {
                    return LockStatus.released();
                }

                @Override
                public LockStatus check(InstanceId instanceId, String authToken) {
                    self.get().applyServerState(instanceId, LockState.GRANTED, "tab-b");
                    return LockStatus.released();
                }
            };
            LockManager a = new LockManager(racing, "tab-a", new SyncEventLog(root.resolve("e.jsonl"), "test"));
            self.set(a);

            LockStatus acquired = a.acquire(LAYOUT, null);
            Assertions.assertEquals(LockState.TRANSFERRING, acquired.state());
            Assertions.assertEquals("tab-b", acquired.holder());
            Assertions.assertFalse(acquired.canEdit());
            Assertions.assertEquals(acquired, a.status(LAYOUT));

            LockStatus checked = a.check(LAYOUT, null);
            Assertions.assertEquals(LockState.GRANTED, checked.state());
            Assertions.assertEquals("tab-b", checked.holder());
            Assertions.assertTrue(Files.readString(root.resolve("e.jsonl")).contains("superseded"));
        } finally {
            TestImages.deleteRecursively(root);
        }
    }

    @Test
    void transportFailureRestoresPreviousState() throws Exception {
        Path root = Files.createTempDirectory("captionsync-test-lock-fail-");
        try {
            FakeLockService server = new FakeLockService();
            LockManager a = new LockManager(server.clientView("tab-a"), "tab-a", new SyncEventLog(root.resolve("e.jsonl"), "test"));
            server.setUnreachable(true);
            Assertions.assertThrows(LockException.class, () -> a.acquire(LAYOUT, null));
            Assertions.assertEquals(LockState.RELEASED, a.status(LAYOUT).state());
        } finally {
            TestImages.deleteRecursively(root);
        }
    }

    @Test
    void releaseAllReleasesOnlyHeldLocks() throws Exception {
        Path root = Files.createTempDirectory("captionsync-test-lock-all-");
        try {
            FakeLockService server = new FakeLockService();
            InstanceId captions = InstanceId.of("v1", "captions");
            LockManager a = new LockManager(server.clientView("tab-a"), "tab-a", new SyncEventLog(root.resolve("e.jsonl"), "test"));
            LockManager b = new LockManager(server.clientView("tab-b"), "tab-b", new SyncEventLog(root.resolve("e.jsonl"), "test"));
            a.acquire(LAYOUT, "t");
            b.acquire(captions, "t");
            a.acquire(captions, "t");

            Assertions.assertEquals(List.of(LAYOUT), a.releaseAll());
            Assertions.assertNull(server.holder(LAYOUT));
            Assertions.assertEquals("tab-b", server.holder(captions));
        } finally {
            TestImages.deleteRecursively(root);
        }
    }
}
