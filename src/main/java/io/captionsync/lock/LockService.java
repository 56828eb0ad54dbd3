package io.captionsync.lock;

import io.captionsync.model.InstanceId;
import io.captionsync.model.LockStatus;

/**
 * Server-side mutual exclusion for one database instance. A denial is a normal response, not an error.
 */
public interface LockService {

    LockStatus acquire(InstanceId instanceId, String authToken);

    LockStatus release(InstanceId instanceId, String authToken);

    LockStatus check(InstanceId instanceId, String authToken);
}
