package io.captionsync.sync;

import java.net.http.WebSocket;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link SyncChannel} over the JDK WebSocket client. Sends are chained so at most one is outstanding.
 * The first failed send aborts the socket and is reported to the listener; later sends are refused.
 */
final class WebSocketSyncChannel implements SyncChannel {
    private final WebSocket socket;
    private final SyncChannel.Listener listener;
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private CompletableFuture<WebSocket> lastSend;

    WebSocketSyncChannel(WebSocket socket, SyncChannel.Listener listener) {
        this.socket = socket;
        this.listener = listener;
        this.lastSend = CompletableFuture.completedFuture(socket);
    }

    @Override
    public void send(String frame) {
        CompletableFuture<WebSocket> sent;
        synchronized (this) {
            Throwable failed = failure.get();
            if (failed != null) {
                throw new IllegalStateException("WebSocket send failed earlier", failed);
            }
            if (socket.isOutputClosed()) {
                throw new IllegalStateException("WebSocket output is closed");
            }
            sent = lastSend.exceptionally(error -> socket).thenCompose(ws -> ws.sendText(frame, true));
            lastSend = sent;
        }
        sent.whenComplete((ws, error) -> {
            if (error != null) {
                failed(error);
            }
        });
    }

    @Override
    public synchronized void close(int code, String reason) {
        if (socket.isOutputClosed()) {
            return;
        }
        lastSend = lastSend.exceptionally(error -> socket)
                .thenCompose(ws -> ws.sendClose(code, reason == null ? "" : reason));
    }

    private void failed(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (!failure.compareAndSet(null, cause)) {
            return;
        }
        socket.abort();
        listener.onFailure(cause);
    }

    /**
     * Reassembles partial text messages and forwards complete frames.
     */
    static final class Adapter implements WebSocket.Listener {
        private final SyncChannel.Listener listener;
        private final StringBuilder partial = new StringBuilder();

        Adapter(SyncChannel.Listener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            try {
                if (last) {
                    String frame = partial.toString();
                    partial.setLength(0);
                    listener.onMessage(frame);
                }
            } finally {
                webSocket.request(1);
            }
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            listener.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onFailure(error);
        }
    }
}
