package io.captionsync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.captionsync.model.InstanceId;
import io.captionsync.util.Jsons;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory sync endpoint. Acks arrive inline from {@code send} when auto-ack is on.
 */
public final class FakeSyncServer implements SyncChannelFactory {
    private final AtomicBoolean reachable = new AtomicBoolean(true);
    private final AtomicBoolean autoAck = new AtomicBoolean(true);
    private final AtomicInteger opens = new AtomicInteger();
    private final AtomicLong serverVersion = new AtomicLong();
    private final List<JsonNode> received = new CopyOnWriteArrayList<>();
    private final List<JsonNode> unacked = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<InstanceId, Channel> channels = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<SyncChannel> open(InstanceId instanceId, String authToken, SyncChannel.Listener listener) {
        opens.incrementAndGet();
        if (!reachable.get()) {
            return CompletableFuture.failedFuture(new IOException("connection refused"));
        }
        Channel channel = new Channel(instanceId, listener);
        channels.put(instanceId, channel);
        return CompletableFuture.completedFuture(channel);
    }

    public void setReachable(boolean value) {
        reachable.set(value);
    }

    public void setAutoAck(boolean value) {
        autoAck.set(value);
    }

    public int opens() {
        return opens.get();
    }

    public List<JsonNode> received() {
        return List.copyOf(received);
    }

    public List<JsonNode> receivedOfType(String type) {
        List<JsonNode> out = new ArrayList<>();
        for (JsonNode node : received) {
            if (type.equals(node.path("type").asText())) {
                out.add(node);
            }
        }
        return out;
    }

    public Channel channel(InstanceId instanceId) {
        return channels.get(instanceId);
    }

    /**
     * Acknowledges every outstanding changes frame, oldest first.
     */
    public void ackAll(InstanceId instanceId) {
        Channel channel = channels.get(instanceId);
        List<JsonNode> pending = new ArrayList<>(unacked);
        unacked.clear();
        for (JsonNode frame : pending) {
            channel.push(ack(frame));
        }
    }

    private String ack(JsonNode frame) {
        long version = Math.max(serverVersion.get(), frame.path("version").asLong());
        serverVersion.set(version);
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("type", "ack");
        node.put("version", version);
        node.put("messageId", frame.path("messageId").asText());
        return Jsons.toCompactJson(node);
    }

    public final class Channel implements SyncChannel {
        private final InstanceId instanceId;
        private final SyncChannel.Listener listener;
        private volatile boolean closed;
        private volatile int closeCode = -1;

        private Channel(InstanceId instanceId, SyncChannel.Listener listener) {
            this.instanceId = instanceId;
            this.listener = listener;
        }

        @Override
        public void send(String frame) {
            if (closed) {
                throw new IllegalStateException("channel closed");
            }
            JsonNode node;
            try {
                node = Jsons.mapper().readTree(frame);
            } catch (IOException e) {
                throw new IllegalArgumentException("bad frame", e);
            }
            received.add(node);
            if ("changes".equals(node.path("type").asText())) {
                if (autoAck.get()) {
                    push(ack(node));
                } else {
                    unacked.add(node);
                }
            }
        }

        @Override
        public void close(int code, String reason) {
            closed = true;
            closeCode = code;
        }

        public void push(String frame) {
            listener.onMessage(frame);
        }

        /**
         * Simulates the server dropping the connection.
         */
        public void drop(int code) {
            closed = true;
            listener.onClosed(code, "dropped");
        }

        public boolean isClosed() {
            return closed;
        }

        public int closeCode() {
            return closeCode;
        }

        public InstanceId instanceId() {
            return instanceId;
        }
    }
}
