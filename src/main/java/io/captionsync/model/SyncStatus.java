package io.captionsync.model;

import java.time.Instant;

public record SyncStatus(
        boolean connected,
        boolean syncing,
        Instant lastSyncTime,
        int pendingChanges,
        ConnectionState connectionState
) {

    public static SyncStatus initial() {
        return new SyncStatus(false, false, null, 0, ConnectionState.DISCONNECTED);
    }

    public SyncStatus withConnectionState(ConnectionState state) {
        return new SyncStatus(state == ConnectionState.CONNECTED, syncing, lastSyncTime, pendingChanges, state);
    }

    public SyncStatus withPendingChanges(int pending) {
        return new SyncStatus(connected, syncing, lastSyncTime, Math.max(0, pending), connectionState);
    }

    public SyncStatus withSyncing(boolean value) {
        return new SyncStatus(connected, value, lastSyncTime, pendingChanges, connectionState);
    }

    public SyncStatus withLastSyncTime(Instant time) {
        return new SyncStatus(connected, syncing, time, pendingChanges, connectionState);
    }
}
