package io.captionsync.registry;

import io.captionsync.error.DatabaseException;
import io.captionsync.model.DatabaseName;
import io.captionsync.model.DownloadProgress;
import io.captionsync.model.InstanceId;
import io.captionsync.model.LockStatus;
import io.captionsync.model.SyncStatus;

import java.time.Instant;

/**
 * Immutable view of one live instance at a point in time.
 */
public record InstanceSnapshot(
        InstanceId instanceId,
        boolean ready,
        long version,
        SyncStatus syncStatus,
        LockStatus lockStatus,
        DownloadProgress downloadProgress,
        DatabaseException error,
        Instant initializedAt
) {

    public String videoId() {
        return instanceId.videoId();
    }

    public DatabaseName databaseName() {
        return instanceId.databaseName();
    }

    public boolean canEdit() {
        return lockStatus != null && lockStatus.canEdit();
    }
}
