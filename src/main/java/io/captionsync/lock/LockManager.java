package io.captionsync.lock;

import io.captionsync.error.DatabaseException;
import io.captionsync.error.LockException;
import io.captionsync.model.InstanceId;
import io.captionsync.model.LockState;
import io.captionsync.model.LockStatus;
import io.captionsync.observability.SyncEventLog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Client-side lock state machine per instance: released, pending, granted, transferring.
 * Staleness is decided by the server; nothing here expires on its own.
 */
public final class LockManager {
    private final LockService service;
    private final String clientId;
    private final SyncEventLog eventLog;
    private final ConcurrentHashMap<InstanceId, LockStatus> states = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<InstanceId, String> tokens = new ConcurrentHashMap<>();

    public LockManager(LockService service, String clientId, SyncEventLog eventLog) {
        this.service = service;
        this.clientId = clientId;
        this.eventLog = eventLog;
    }

    public String clientId() {
        return clientId;
    }

    public LockStatus acquire(InstanceId instanceId, String authToken) {
        remember(instanceId, authToken);
        LockStatus current = status(instanceId);
        if (current.canEdit()) {
            return current;
        }
        LockStatus pending = LockStatus.pending(clientId);
        states.put(instanceId, pending);
        LockStatus response;
        try {
            response = service.acquire(instanceId, authToken);
        } catch (LockException e) {
            states.replace(instanceId, pending, current);
            eventLog.log("lock.acquire", instanceId, "error", e.toDetails());
            throw e;
        }
        LockStatus next;
        if (response.state() == LockState.GRANTED && clientId.equals(response.holder())) {
            next = LockStatus.derive(LockState.GRANTED, clientId, clientId);
        } else {
            next = new LockStatus(LockState.RELEASED, response.holder(), false);
        }
        // a pushed transition received while the request was in flight is newer than the response
        if (!states.replace(instanceId, pending, next)) {
            LockStatus pushed = status(instanceId);
            eventLog.log("lock.acquire", instanceId, "superseded", details(pushed));
            return pushed;
        }
        eventLog.log("lock.acquire", instanceId, next.canEdit() ? "granted" : "denied", details(next));
        return next;
    }

    public LockStatus release(InstanceId instanceId, String authToken) {
        remember(instanceId, authToken);
        LockStatus current = status(instanceId);
        if (!current.heldBy(clientId) || current.state() == LockState.RELEASED) {
            states.put(instanceId, LockStatus.released());
            return LockStatus.released();
        }
        try {
            service.release(instanceId, authToken);
        } catch (LockException e) {
            eventLog.log("lock.release", instanceId, "error", e.toDetails());
            throw e;
        }
        states.put(instanceId, LockStatus.released());
        eventLog.log("lock.release", instanceId, "released", Map.of());
        return LockStatus.released();
    }

    public LockStatus check(InstanceId instanceId, String authToken) {
        remember(instanceId, authToken);
        LockStatus before = states.get(instanceId);
        LockStatus response = service.check(instanceId, authToken);
        LockStatus next = LockStatus.derive(response.state(), response.holder(), clientId);
        boolean stored = before == null
                ? states.putIfAbsent(instanceId, next) == null
                : states.replace(instanceId, before, next);
        return stored ? next : status(instanceId);
    }

    /**
     * Reflects a lock transition pushed by the server.
     */
    public LockStatus applyServerState(InstanceId instanceId, LockState state, String holder) {
        LockStatus next = LockStatus.derive(state, holder, clientId);
        LockStatus previous = states.put(instanceId, next);
        if (previous != null && previous.canEdit() && !next.canEdit()) {
            eventLog.log("lock.revoked", instanceId, state.wireName(), details(next));
        }
        return next;
    }

    /**
     * Editing authority moved to another session of the same holder.
     */
    public LockStatus markSessionTransferred(InstanceId instanceId, String newTabId) {
        LockStatus next = new LockStatus(LockState.TRANSFERRING, newTabId, false);
        states.put(instanceId, next);
        eventLog.log("lock.session_transferred", instanceId, "transferring", details(next));
        return next;
    }

    public LockStatus status(InstanceId instanceId) {
        return states.getOrDefault(instanceId, LockStatus.released());
    }

    /**
     * Releases every lock this client holds. Failures are logged and skipped.
     */
    public List<InstanceId> releaseAll() {
        List<InstanceId> released = new ArrayList<>();
        for (Map.Entry<InstanceId, LockStatus> entry : new ArrayList<>(states.entrySet())) {
            if (!entry.getValue().canEdit()) {
                continue;
            }
            try {
                release(entry.getKey(), tokens.get(entry.getKey()));
                released.add(entry.getKey());
            } catch (DatabaseException e) {
                eventLog.log("lock.release_all", entry.getKey(), "skipped", e.toDetails());
            }
        }
        return released;
    }

    public void forget(InstanceId instanceId) {
        states.remove(instanceId);
        tokens.remove(instanceId);
    }

    private void remember(InstanceId instanceId, String authToken) {
        if (authToken != null && !authToken.isBlank()) {
            tokens.put(instanceId, authToken);
        }
    }

    private static Map<String, Object> details(LockStatus status) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("state", status.state().wireName());
        out.put("holder", status.holder() == null ? "" : status.holder());
        out.put("can_edit", status.canEdit());
        return out;
    }
}
