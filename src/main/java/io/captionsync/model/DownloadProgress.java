package io.captionsync.model;

/**
 * Byte-level download progress. {@code totalBytes} is -1 when the server did not send a length.
 */
public record DownloadProgress(
        DownloadPhase phase,
        long bytesReceived,
        long totalBytes,
        int attempt,
        String error
) {

    public static DownloadProgress downloading(long bytesReceived, long totalBytes, int attempt) {
        return new DownloadProgress(DownloadPhase.DOWNLOADING, bytesReceived, totalBytes, attempt, null);
    }

    public static DownloadProgress decompressing(long bytes, int attempt) {
        return new DownloadProgress(DownloadPhase.DECOMPRESSING, bytes, bytes, attempt, null);
    }

    public static DownloadProgress complete(long bytes, int attempt) {
        return new DownloadProgress(DownloadPhase.COMPLETE, bytes, bytes, attempt, null);
    }

    public static DownloadProgress failed(int attempt, String error) {
        return new DownloadProgress(DownloadPhase.ERROR, 0L, -1L, attempt, error);
    }

    public int percent() {
        if (phase == DownloadPhase.COMPLETE || phase == DownloadPhase.DECOMPRESSING) {
            return 100;
        }
        if (totalBytes <= 0L) {
            return 0;
        }
        return (int) Math.min(100L, Math.round(bytesReceived * 100.0d / totalBytes));
    }
}
