package io.captionsync.error;

import io.captionsync.model.InstanceId;

public class CorruptImageException extends DatabaseException {

    public CorruptImageException(String message, InstanceId instanceId, Throwable cause) {
        super(ErrorCode.CORRUPT_IMAGE, message, instanceId, cause);
    }
}
