package io.captionsync.error;

public enum RecoveryStrategy {
    RETRY,
    RECONNECT,
    REACQUIRE_LOCK,
    REINITIALIZE,
    SWITCH_TAB,
    LOGIN,
    NONE;

    public static RecoveryStrategy forError(DatabaseException error) {
        if (error == null) {
            return NONE;
        }
        return forCode(error.code());
    }

    public static RecoveryStrategy forCode(ErrorCode code) {
        if (code == null) {
            return NONE;
        }
        return switch (code) {
            case DOWNLOAD_FAILED, NETWORK_ERROR, SYNC_TIMEOUT, APPLY_FAILED -> RETRY;
            case SYNC_FAILED, WEBSOCKET_CLOSED, WEBSOCKET_ERROR -> RECONNECT;
            case LOCK_DENIED, LOCK_ACQUIRE_FAILED, LOCK_RELEASE_FAILED -> REACQUIRE_LOCK;
            case DATABASE_INIT_FAILED, NOT_INITIALIZED, CORRUPT_IMAGE, DECOMPRESS_FAILED -> REINITIALIZE;
            case SESSION_TRANSFERRED -> SWITCH_TAB;
            case AUTH_REQUIRED -> LOGIN;
            case PERMISSION_DENIED, QUERY_FAILED, INVALID_QUERY, UNKNOWN_ERROR -> NONE;
        };
    }
}
