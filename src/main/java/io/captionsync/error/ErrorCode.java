package io.captionsync.error;

public enum ErrorCode {
    DOWNLOAD_FAILED(true),
    DECOMPRESS_FAILED(false),
    DATABASE_INIT_FAILED(true),
    CORRUPT_IMAGE(false),
    SYNC_FAILED(true),
    WEBSOCKET_CLOSED(true),
    WEBSOCKET_ERROR(true),
    SYNC_TIMEOUT(true),
    LOCK_DENIED(true),
    LOCK_ACQUIRE_FAILED(true),
    LOCK_RELEASE_FAILED(true),
    SESSION_TRANSFERRED(false),
    AUTH_REQUIRED(false),
    PERMISSION_DENIED(false),
    QUERY_FAILED(false),
    INVALID_QUERY(false),
    APPLY_FAILED(true),
    NOT_INITIALIZED(true),
    NETWORK_ERROR(true),
    UNKNOWN_ERROR(false);

    private final boolean recoverableByDefault;

    ErrorCode(boolean recoverableByDefault) {
        this.recoverableByDefault = recoverableByDefault;
    }

    public boolean recoverableByDefault() {
        return recoverableByDefault;
    }
}
