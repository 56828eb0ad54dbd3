package io.captionsync.error;

import io.captionsync.model.InstanceId;

public class SyncException extends DatabaseException {

    public SyncException(ErrorCode code, String message, InstanceId instanceId, Throwable cause) {
        super(code, message, instanceId, cause);
    }
}
