package io.captionsync.registry;

import io.captionsync.model.DownloadProgress;

import java.util.function.Consumer;

/**
 * Per-call options for {@link InstanceRegistry#initialize}.
 */
public record InitializeOptions(
        boolean acquireLock,
        boolean forceDownload,
        String authToken,
        Consumer<DownloadProgress> onProgress
) {

    public static InitializeOptions defaults() {
        return new InitializeOptions(false, false, null, null);
    }

    public static InitializeOptions editing(String authToken) {
        return new InitializeOptions(true, false, authToken, null);
    }

    public InitializeOptions withProgress(Consumer<DownloadProgress> listener) {
        return new InitializeOptions(acquireLock, forceDownload, authToken, listener);
    }

    public InitializeOptions withForceDownload(boolean force) {
        return new InitializeOptions(acquireLock, force, authToken, onProgress);
    }
}
