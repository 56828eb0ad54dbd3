package io.captionsync.error;

import io.captionsync.model.InstanceId;

public class ApplyChangesException extends DatabaseException {

    public ApplyChangesException(String message, InstanceId instanceId, Throwable cause) {
        super(ErrorCode.APPLY_FAILED, message, instanceId, cause);
    }
}
