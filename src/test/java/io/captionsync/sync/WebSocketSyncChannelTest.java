package io.captionsync.sync;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

final class WebSocketSyncChannelTest {

    @Test
    void failedSendIsReportedOnceAndLaterSendsAreRefused() {
        StubSocket socket = new StubSocket();
        RecordingListener listener = new RecordingListener();
        WebSocketSyncChannel channel = new WebSocketSyncChannel(socket, listener);

        channel.send("{\"type\":\"ping\"}");
        Assertions.assertEquals(List.of("{\"type\":\"ping\"}"), socket.sent);
        Assertions.assertTrue(listener.failures.isEmpty());

        socket.failNext = true;
        channel.send("{\"type\":\"changes\"}");
        Assertions.assertEquals(1, listener.failures.size());
        Assertions.assertTrue(socket.aborted);

        IllegalStateException refused = Assertions.assertThrows(IllegalStateException.class,
                () -> channel.send("{\"type\":\"changes\"}"));
        Assertions.assertInstanceOf(IOException.class, refused.getCause());
        Assertions.assertEquals(1, listener.failures.size());
    }

    @Test
    void adapterKeepsRequestingAfterListenerFailure() {
        StubSocket socket = new StubSocket();
        RecordingListener listener = new RecordingListener();
        listener.throwOnMessage = true;
        WebSocketSyncChannel.Adapter adapter = new WebSocketSyncChannel.Adapter(listener);

        adapter.onText(socket, "{\"type\":", false);
        Assertions.assertThrows(IllegalStateException.class, () -> adapter.onText(socket, "\"pong\"}", true));
        Assertions.assertEquals(2, socket.requested.get());
        Assertions.assertEquals(List.of("{\"type\":\"pong\"}"), listener.messages);
    }

    private static final class RecordingListener implements SyncChannel.Listener {
        final List<String> messages = new CopyOnWriteArrayList<>();
        final List<Throwable> failures = new CopyOnWriteArrayList<>();
        volatile boolean throwOnMessage;

        @Override
        public void onMessage(String frame) {
            messages.add(frame);
            if (throwOnMessage) {
                throw new IllegalStateException("listener failed");
            }
        }

        @Override
        public void onClosed(int code, String reason) {
        }

        @Override
        public void onFailure(Throwable error) {
            failures.add(error);
        }
    }

    private static final class StubSocket implements WebSocket {
        final List<String> sent = new CopyOnWriteArrayList<>();
        final AtomicInteger requested = new AtomicInteger();
        volatile boolean failNext;
        volatile boolean aborted;

        @Override
        public CompletableFuture<WebSocket> sendText(CharSequence data, boolean last) {
            if (failNext) {
                failNext = false;
                return CompletableFuture.failedFuture(new IOException("broken pipe"));
            }
            sent.add(data.toString());
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public CompletableFuture<WebSocket> sendBinary(ByteBuffer data, boolean last) {
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public CompletableFuture<WebSocket> sendPing(ByteBuffer message) {
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public CompletableFuture<WebSocket> sendPong(ByteBuffer message) {
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public CompletableFuture<WebSocket> sendClose(int statusCode, String reason) {
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public void request(long n) {
            requested.incrementAndGet();
        }

        @Override
        public String getSubprotocol() {
            return "";
        }

        @Override
        public boolean isOutputClosed() {
            return aborted;
        }

        @Override
        public boolean isInputClosed() {
            return aborted;
        }

        @Override
        public void abort() {
            aborted = true;
        }
    }
}
