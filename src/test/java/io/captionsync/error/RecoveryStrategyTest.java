package io.captionsync.error;

import io.captionsync.model.InstanceId;
import io.captionsync.model.LockState;
import io.captionsync.model.LockStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

final class RecoveryStrategyTest {

    @Test
    void everyCodeHasAStrategy() {
        for (ErrorCode code : ErrorCode.values()) {
            Assertions.assertNotNull(RecoveryStrategy.forCode(code), code.name());
        }
        Assertions.assertEquals(RecoveryStrategy.RETRY, RecoveryStrategy.forCode(ErrorCode.DOWNLOAD_FAILED));
        Assertions.assertEquals(RecoveryStrategy.RECONNECT, RecoveryStrategy.forCode(ErrorCode.WEBSOCKET_CLOSED));
        Assertions.assertEquals(RecoveryStrategy.REACQUIRE_LOCK, RecoveryStrategy.forCode(ErrorCode.LOCK_DENIED));
        Assertions.assertEquals(RecoveryStrategy.REINITIALIZE, RecoveryStrategy.forCode(ErrorCode.CORRUPT_IMAGE));
        Assertions.assertEquals(RecoveryStrategy.SWITCH_TAB, RecoveryStrategy.forCode(ErrorCode.SESSION_TRANSFERRED));
        Assertions.assertEquals(RecoveryStrategy.LOGIN, RecoveryStrategy.forCode(ErrorCode.AUTH_REQUIRED));
        Assertions.assertEquals(RecoveryStrategy.NONE, RecoveryStrategy.forCode(ErrorCode.PERMISSION_DENIED));
        Assertions.assertEquals(RecoveryStrategy.NONE, RecoveryStrategy.forError(null));
    }

    @Test
    void wrapKeepsTypedExceptionsAndClassifiesOthers() {
        InstanceId id = InstanceId.of("v1", "layout");
        SyncException typed = new SyncException(ErrorCode.SYNC_FAILED, "boom", id, null);
        Assertions.assertSame(typed, DatabaseException.wrap(typed, ErrorCode.UNKNOWN_ERROR, id));

        DatabaseException wrapped = DatabaseException.wrap(new IOException("reset"), ErrorCode.NETWORK_ERROR, id);
        Assertions.assertEquals(ErrorCode.NETWORK_ERROR, wrapped.code());
        Assertions.assertTrue(wrapped.recoverable());
        Assertions.assertEquals(RecoveryStrategy.RETRY, wrapped.recoveryStrategy());
        Assertions.assertInstanceOf(IOException.class, wrapped.getCause());
    }

    @Test
    void permissionDeniedCarriesLockContext() {
        InstanceId id = InstanceId.of("v1", "layout");
        PermissionDeniedException denied = new PermissionDeniedException(id,
                new LockStatus(LockState.GRANTED, "client-b", false));

        Assertions.assertFalse(denied.recoverable());
        Map<String, Object> details = denied.toDetails();
        Assertions.assertEquals("PERMISSION_DENIED", details.get("code"));
        Assertions.assertEquals("v1:layout", details.get("instance_id"));
        Assertions.assertEquals("granted", details.get("lock_state"));
        Assertions.assertEquals("client-b", details.get("lock_holder"));
        Assertions.assertEquals("none", details.get("recovery"));
    }
}
