package io.captionsync.download;

import io.captionsync.model.InstanceId;

public record DownloadRequest(String tenantId, InstanceId instanceId, boolean forceDownload, String authToken) {

    public DownloadRequest {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId must not be null");
        }
        tenantId = tenantId.trim();
    }

    /**
     * Object key of the compressed image in remote storage.
     */
    public String storageKey() {
        return tenantId + "/client/videos/" + instanceId.videoId() + "/" + instanceId.databaseName().wireName() + ".db.gz";
    }
}
