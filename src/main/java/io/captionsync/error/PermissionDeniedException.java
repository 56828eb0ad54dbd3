package io.captionsync.error;

import io.captionsync.model.InstanceId;
import io.captionsync.model.LockStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when a mutation is attempted without editing authority. The engine is never touched.
 */
public class PermissionDeniedException extends DatabaseException {

    public PermissionDeniedException(InstanceId instanceId, LockStatus lockStatus) {
        super(ErrorCode.PERMISSION_DENIED,
                "Editing " + instanceId + " requires the database lock",
                null,
                instanceId,
                false,
                details(lockStatus));
    }

    private static Map<String, Object> details(LockStatus status) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("lock_state", status == null ? "none" : status.state().wireName());
        if (status != null && status.holder() != null) {
            out.put("lock_holder", status.holder());
        }
        return out;
    }
}
