package io.captionsync.sync;

import io.captionsync.error.SyncException;
import io.captionsync.model.ChangeSet;
import io.captionsync.model.ConnectionState;
import io.captionsync.model.LockState;

/**
 * Receives decoded server frames and connection transitions. Never invoked while the manager holds its own monitor.
 */
public interface SyncListener {

    void onRemoteChanges(ChangeSet changes);

    void onAck(long version, int pendingChanges);

    void onLockState(LockState state, String holder);

    void onSessionTransferred(String newTabId);

    void onError(SyncException error);

    void onConnectionChanged(ConnectionState state, int pendingChanges);
}
