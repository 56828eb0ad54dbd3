package io.captionsync.lock;

import io.captionsync.error.ErrorCode;
import io.captionsync.error.LockException;
import io.captionsync.model.InstanceId;
import io.captionsync.model.LockState;
import io.captionsync.model.LockStatus;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory lock server shared by several clients.
 */
public final class FakeLockService {
    private final ConcurrentHashMap<InstanceId, String> holders = new ConcurrentHashMap<>();
    private final AtomicBoolean unreachable = new AtomicBoolean(false);
    private final AtomicInteger calls = new AtomicInteger();

    public LockService clientView(String clientId) {
        return new LockService() {
            @Override
            public LockStatus acquire(InstanceId instanceId, String authToken) {
                touch(instanceId);
                String holder = holders.putIfAbsent(instanceId, clientId);
                String effective = holder == null ? clientId : holder;
                return new LockStatus(LockState.GRANTED, effective, effective.equals(clientId));
            }

            @Override
            public LockStatus release(InstanceId instanceId, String authToken) {
                touch(instanceId);
                holders.remove(instanceId, clientId);
                return LockStatus.released();
            }

            @Override
            public LockStatus check(InstanceId instanceId, String authToken) {
                touch(instanceId);
                String holder = holders.get(instanceId);
                return holder == null
                        ? LockStatus.released()
                        : new LockStatus(LockState.GRANTED, holder, holder.equals(clientId));
            }
        };
    }

    public void setUnreachable(boolean value) {
        unreachable.set(value);
    }

    public String holder(InstanceId instanceId) {
        return holders.get(instanceId);
    }

    public int calls() {
        return calls.get();
    }

    private void touch(InstanceId instanceId) {
        calls.incrementAndGet();
        if (unreachable.get()) {
            throw new LockException(ErrorCode.LOCK_ACQUIRE_FAILED, "lock service down", instanceId, null);
        }
    }
}
