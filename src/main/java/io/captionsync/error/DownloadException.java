package io.captionsync.error;

import io.captionsync.model.InstanceId;

import java.util.Map;

public class DownloadException extends DatabaseException {
    private final int attempts;
    private final int httpStatus;

    public DownloadException(ErrorCode code, String message, InstanceId instanceId, int attempts, int httpStatus, Throwable cause) {
        super(code, message, cause, instanceId, code.recoverableByDefault(),
                Map.of("attempts", attempts, "http_status", httpStatus));
        this.attempts = attempts;
        this.httpStatus = httpStatus;
    }

    public static DownloadException exhausted(InstanceId instanceId, int attempts, int httpStatus, Throwable cause) {
        String reason = cause == null ? "HTTP " + httpStatus : cause.getMessage();
        return new DownloadException(ErrorCode.DOWNLOAD_FAILED,
                "Failed to download database image after " + attempts + " attempt(s): " + reason,
                instanceId, attempts, httpStatus, cause);
    }

    public int attempts() {
        return attempts;
    }

    /**
     * Last HTTP status seen, or -1 when the failure happened below HTTP.
     */
    public int httpStatus() {
        return httpStatus;
    }
}
