package io.captionsync.error;

import io.captionsync.model.InstanceId;

public class LockException extends DatabaseException {

    public LockException(ErrorCode code, String message, InstanceId instanceId, Throwable cause) {
        super(code, message, instanceId, cause);
    }
}
