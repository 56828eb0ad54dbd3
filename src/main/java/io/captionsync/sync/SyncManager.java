package io.captionsync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import io.captionsync.config.SyncSettings;
import io.captionsync.error.DatabaseException;
import io.captionsync.error.ErrorCode;
import io.captionsync.error.SyncException;
import io.captionsync.model.ChangeSet;
import io.captionsync.model.ConnectionState;
import io.captionsync.model.InstanceId;
import io.captionsync.model.LockState;
import io.captionsync.observability.SyncEventLog;
import io.captionsync.util.Backoff;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns the duplex channel of one instance: outbound queue, acknowledgements, reconnects and heartbeat.
 * <p>
 * State is guarded by this object's monitor. Channel I/O and {@link SyncListener} callbacks always happen
 * outside it, so a listener may call back into the manager freely.
 */
public final class SyncManager {
    private static final int NORMAL_CLOSURE = 1000;
    private static final int GOING_AWAY = 1001;

    private final InstanceId instanceId;
    private final SyncChannelFactory channelFactory;
    private final ScheduledExecutorService scheduler;
    private final SyncListener listener;
    private final SyncEventLog eventLog;
    private final Backoff backoff;
    private final int reconnectAttemptCeiling;
    private final long heartbeatIntervalMs;

    private final Deque<SyncFrames.Outbound> queued = new ArrayDeque<>();
    private final LinkedHashMap<String, SyncFrames.Outbound> inflight = new LinkedHashMap<>();
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private SyncChannel channel;
    private long generation;
    private long localVersion;
    private String authToken;
    private int reconnectAttempts;
    private boolean outageReported;
    private boolean stopped;
    private Integer serverPending;
    private ScheduledFuture<?> heartbeat;
    private ScheduledFuture<?> reconnect;

    public SyncManager(
            InstanceId instanceId,
            SyncChannelFactory channelFactory,
            ScheduledExecutorService scheduler,
            SyncSettings settings,
            SyncListener listener,
            SyncEventLog eventLog
    ) {
        this.instanceId = instanceId;
        this.channelFactory = channelFactory;
        this.scheduler = scheduler;
        this.listener = listener;
        this.eventLog = eventLog;
        this.backoff = settings.reconnectBackoff();
        this.reconnectAttemptCeiling = settings.reconnectAttemptCeiling();
        this.heartbeatIntervalMs = settings.heartbeatIntervalMs();
    }

    public synchronized void setLocalVersion(long version) {
        localVersion = Math.max(localVersion, version);
    }

    public synchronized long localVersion() {
        return localVersion;
    }

    public void connect(String token) {
        long attempt;
        synchronized (this) {
            if (stopped) {
                throw new SyncException(ErrorCode.NOT_INITIALIZED, "Sync for " + instanceId + " was disconnected", instanceId, null);
            }
            authToken = token;
            if (state != ConnectionState.DISCONNECTED) {
                return;
            }
            state = ConnectionState.CONNECTING;
            attempt = ++generation;
        }
        notifyConnection();
        openChannel(attempt);
    }

    /**
     * Queues a change set for the server and returns the resulting number of pending change sets.
     * Safe while disconnected; queued frames are flushed on the next connect.
     */
    public int sendChanges(ChangeSet changes, long baseVersion) {
        SyncFrames.Outbound frame = new SyncFrames.Outbound(UUID.randomUUID().toString(), changes, baseVersion);
        SyncChannel target;
        synchronized (this) {
            if (stopped) {
                throw new SyncException(ErrorCode.NOT_INITIALIZED, "Sync for " + instanceId + " was disconnected", instanceId, null);
            }
            localVersion = Math.max(localVersion, changes.resultingVersion());
            serverPending = null;
            if (state == ConnectionState.CONNECTED && channel != null) {
                inflight.put(frame.messageId(), frame);
                target = channel;
            } else {
                queued.addLast(frame);
                target = null;
            }
        }
        if (target != null) {
            transmit(target, SyncFrames.changes(frame), generationSnapshot());
        }
        return pendingChanges();
    }

    public synchronized ConnectionState connectionState() {
        return state;
    }

    public synchronized int pendingChanges() {
        return pendingLocked();
    }

    /**
     * Stops heartbeat and reconnects and closes the channel. Unsent frames are dropped.
     */
    public void disconnect() {
        SyncChannel toClose;
        synchronized (this) {
            if (stopped) {
                return;
            }
            stopped = true;
            generation++;
            cancelTimersLocked();
            toClose = channel;
            channel = null;
            queued.clear();
            inflight.clear();
            serverPending = null;
            state = ConnectionState.DISCONNECTED;
        }
        if (toClose != null) {
            try {
                toClose.close(NORMAL_CLOSURE, "client closing");
            } catch (RuntimeException e) {
                eventLog.log("sync.close", instanceId, "error", Map.of("error", String.valueOf(e.getMessage())));
            }
        }
    }

    private void openChannel(long attempt) {
        ChannelListener channelListener = new ChannelListener(attempt);
        try {
            channelFactory.open(instanceId, currentToken(), channelListener)
                    .whenComplete((opened, error) -> {
                        if (error != null) {
                            onConnectFailed(attempt, error);
                        } else {
                            onConnected(attempt, opened);
                        }
                    });
        } catch (RuntimeException e) {
            onConnectFailed(attempt, e);
        }
    }

    private void onConnected(long attempt, SyncChannel opened) {
        List<SyncFrames.Outbound> resend = new ArrayList<>();
        boolean stale;
        synchronized (this) {
            stale = stopped || attempt != generation;
            if (!stale) {
                channel = opened;
                state = ConnectionState.CONNECTED;
                reconnectAttempts = 0;
                outageReported = false;
                while (!queued.isEmpty()) {
                    SyncFrames.Outbound frame = queued.pollFirst();
                    inflight.put(frame.messageId(), frame);
                }
                resend.addAll(inflight.values());
                scheduleHeartbeatLocked(attempt);
            }
        }
        if (stale) {
            opened.close(NORMAL_CLOSURE, "superseded");
            return;
        }
        eventLog.log("sync.connected", instanceId, "ok", Map.of("resent", resend.size()));
        notifyConnection();
        for (SyncFrames.Outbound frame : resend) {
            if (!transmit(opened, SyncFrames.changes(frame), attempt)) {
                return;
            }
        }
    }

    private void onConnectFailed(long attempt, Throwable error) {
        dropped(attempt, "connect failed: " + rootMessage(error));
    }

    private void onChannelClosed(long attempt, int code, String reason) {
        if (code == NORMAL_CLOSURE || code == GOING_AWAY) {
            synchronized (this) {
                if (stopped || attempt != generation) {
                    return;
                }
                cancelTimersLocked();
                channel = null;
                state = ConnectionState.DISCONNECTED;
            }
            eventLog.log("sync.closed", instanceId, "server_closed", Map.of("code", code, "reason", reason == null ? "" : reason));
            notifyConnection();
            return;
        }
        dropped(attempt, "closed with code " + code + (reason == null || reason.isBlank() ? "" : ": " + reason));
    }

    private void dropped(long attempt, String why) {
        SyncException outage = null;
        long delay;
        int attempts;
        synchronized (this) {
            if (stopped || attempt != generation) {
                return;
            }
            cancelTimersLocked();
            channel = null;
            state = ConnectionState.RECONNECTING;
            reconnectAttempts++;
            attempts = reconnectAttempts;
            if (reconnectAttempts >= reconnectAttemptCeiling && !outageReported) {
                outageReported = true;
                outage = new SyncException(ErrorCode.WEBSOCKET_CLOSED,
                        "Sync for " + instanceId + " unavailable after " + reconnectAttempts + " attempt(s): " + why,
                        instanceId, null);
            }
            delay = backoff.delayForAttempt(reconnectAttempts - 1);
            long next = ++generation;
            reconnect = scheduler.schedule(() -> openChannel(next), delay, TimeUnit.MILLISECONDS);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attempt", attempts);
        details.put("delay_ms", delay);
        details.put("reason", why);
        eventLog.log("sync.reconnect", instanceId, "scheduled", details);
        notifyConnection();
        if (outage != null) {
            SyncException raised = outage;
            deliver(() -> listener.onError(raised), "error");
        }
    }

    private void onFrame(long attempt, String text) {
        synchronized (this) {
            if (stopped || attempt != generation) {
                return;
            }
        }
        SyncFrames.Inbound frame;
        try {
            frame = SyncFrames.parse(text);
        } catch (IOException e) {
            eventLog.log("sync.frame_invalid", instanceId, "dropped", Map.of("error", String.valueOf(e.getMessage())));
            return;
        }
        JsonNode body = frame.body();
        switch (frame.type()) {
            case SyncFrames.CHANGES -> {
                ChangeSet changes;
                try {
                    changes = SyncFrames.changeSet(body, localVersion());
                } catch (IllegalArgumentException e) {
                    eventLog.log("sync.frame_invalid", instanceId, "dropped", Map.of("error", String.valueOf(e.getMessage())));
                    return;
                }
                deliver(() -> listener.onRemoteChanges(changes), frame.type());
                synchronized (this) {
                    localVersion = Math.max(localVersion, changes.resultingVersion());
                }
            }
            case SyncFrames.ACK -> {
                long version = body.path("version").asLong(0L);
                int pending = acknowledge(body);
                deliver(() -> listener.onAck(version, pending), frame.type());
            }
            case SyncFrames.LOCK -> {
                LockState lockState;
                try {
                    lockState = LockState.fromString(body.path("state").asText(""));
                } catch (IllegalArgumentException e) {
                    eventLog.log("sync.frame_invalid", instanceId, "dropped", Map.of("error", e.getMessage()));
                    return;
                }
                String holder = body.path("holder").isTextual() ? body.path("holder").asText() : null;
                deliver(() -> listener.onLockState(lockState, holder), frame.type());
            }
            case SyncFrames.SESSION_TRANSFERRED -> {
                String newTabId = body.path("newTabId").asText(null);
                deliver(() -> listener.onSessionTransferred(newTabId), frame.type());
            }
            case SyncFrames.ERROR -> {
                String detail = body.path("detail").asText("unknown sync error");
                SyncException error = new SyncException(ErrorCode.SYNC_FAILED, detail, instanceId, null);
                deliver(() -> listener.onError(error), frame.type());
            }
            case SyncFrames.PONG -> {
                // heartbeat reply
            }
            default -> eventLog.log("sync.frame_unknown", instanceId, "ignored", Map.of("type", frame.type()));
        }
    }

    /**
     * An ack naming a message id confirms that frame only, and an unknown id confirms nothing.
     * An ack without one is cumulative: every in-flight frame at or below its version is confirmed.
     */
    private synchronized int acknowledge(JsonNode body) {
        String messageId = body.hasNonNull("messageId") ? body.path("messageId").asText() : null;
        if (messageId != null) {
            if (inflight.remove(messageId) == null) {
                eventLog.log("sync.ack_unmatched", instanceId, "ignored", Map.of("message_id", messageId));
            }
        } else if (body.hasNonNull("version")) {
            long acked = body.path("version").asLong();
            inflight.values().removeIf(frame -> frame.version() <= acked);
        }
        localVersion = Math.max(localVersion, body.path("version").asLong(localVersion));
        serverPending = body.hasNonNull("pending") ? Math.max(0, body.path("pending").asInt(0)) : null;
        return pendingLocked();
    }

    private boolean transmit(SyncChannel target, String text, long attempt) {
        try {
            target.send(text);
            return true;
        } catch (RuntimeException e) {
            dropped(attempt, "send failed: " + e.getMessage());
            return false;
        }
    }

    private void scheduleHeartbeatLocked(long attempt) {
        heartbeat = scheduler.scheduleAtFixedRate(() -> {
            SyncChannel target;
            synchronized (this) {
                if (state != ConnectionState.CONNECTED || attempt != generation) {
                    return;
                }
                target = channel;
            }
            transmit(target, SyncFrames.ping(), attempt);
        }, heartbeatIntervalMs, heartbeatIntervalMs, TimeUnit.MILLISECONDS);
    }

    private void cancelTimersLocked() {
        if (heartbeat != null) {
            heartbeat.cancel(false);
            heartbeat = null;
        }
        if (reconnect != null) {
            reconnect.cancel(false);
            reconnect = null;
        }
    }

    private int pendingLocked() {
        if (serverPending != null) {
            return serverPending;
        }
        return inflight.size() + queued.size();
    }

    private synchronized long generationSnapshot() {
        return generation;
    }

    private synchronized String currentToken() {
        return authToken;
    }

    private void notifyConnection() {
        ConnectionState current;
        int pending;
        synchronized (this) {
            current = state;
            pending = pendingLocked();
        }
        deliver(() -> listener.onConnectionChanged(current, pending), "connection");
    }

    private void deliver(Runnable callback, String what) {
        try {
            callback.run();
        } catch (DatabaseException e) {
            eventLog.log("sync.listener_failed", instanceId, what, e.toDetails());
        } catch (RuntimeException e) {
            eventLog.log("sync.listener_failed", instanceId, what, Map.of("error", e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }

    private static String rootMessage(Throwable error) {
        Throwable cursor = error;
        while (cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        return cursor.getClass().getSimpleName() + ": " + cursor.getMessage();
    }

    private final class ChannelListener implements SyncChannel.Listener {
        private final long attempt;

        private ChannelListener(long attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onMessage(String frame) {
            onFrame(attempt, frame);
        }

        @Override
        public void onClosed(int code, String reason) {
            onChannelClosed(attempt, code, reason);
        }

        @Override
        public void onFailure(Throwable error) {
            dropped(attempt, rootMessage(error));
        }
    }
}
