package io.captionsync.config;

import io.captionsync.util.Backoff;
import io.captionsync.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Tunables read from {@code captionsync-settings.json}. Missing or out-of-range fields fall back to defaults.
 */
public record SyncSettings(
        String storageBaseUrl,
        String apiBaseUrl,
        String syncBaseUrl,
        int downloadMaxAttempts,
        long downloadBaseDelayMs,
        long downloadMaxDelayMs,
        double backoffMultiplier,
        int downloadChunkBytes,
        long requestTimeoutMs,
        long reconnectBaseDelayMs,
        long reconnectMaxDelayMs,
        int reconnectAttemptCeiling,
        long heartbeatIntervalMs,
        long subscriptionDebounceMs,
        int initializeThreads
) {

    public static SyncSettings defaults() {
        return new SyncSettings(
                SyncClientConfig.DEFAULT_STORAGE_BASE_URL,
                SyncClientConfig.DEFAULT_API_BASE_URL,
                SyncClientConfig.DEFAULT_SYNC_BASE_URL,
                SyncClientConfig.DEFAULT_DOWNLOAD_MAX_ATTEMPTS,
                SyncClientConfig.DEFAULT_DOWNLOAD_BASE_DELAY_MS,
                SyncClientConfig.DEFAULT_DOWNLOAD_MAX_DELAY_MS,
                SyncClientConfig.DEFAULT_BACKOFF_MULTIPLIER,
                SyncClientConfig.DEFAULT_DOWNLOAD_CHUNK_BYTES,
                SyncClientConfig.DEFAULT_REQUEST_TIMEOUT_MS,
                SyncClientConfig.DEFAULT_RECONNECT_BASE_DELAY_MS,
                SyncClientConfig.DEFAULT_RECONNECT_MAX_DELAY_MS,
                SyncClientConfig.DEFAULT_RECONNECT_ATTEMPT_CEILING,
                SyncClientConfig.DEFAULT_HEARTBEAT_INTERVAL_MS,
                SyncClientConfig.DEFAULT_SUBSCRIPTION_DEBOUNCE_MS,
                SyncClientConfig.DEFAULT_INITIALIZE_THREADS
        );
    }

    public static SyncSettings load(SyncClientConfig config) {
        return load(config.settingsFile());
    }

    public static SyncSettings load(Path file) {
        SyncSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load sync settings: " + file, e);
        }
    }

    static SyncSettings fromFile(SettingsFile file, SyncSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long downloadBase = sanitizeLong(file.downloadBaseDelayMs(), defaults.downloadBaseDelayMs(), 0L);
        long downloadMax = sanitizeLong(file.downloadMaxDelayMs(), defaults.downloadMaxDelayMs(), downloadBase);
        if (downloadMax < downloadBase) {
            downloadMax = downloadBase;
        }
        long reconnectBase = sanitizeLong(file.reconnectBaseDelayMs(), defaults.reconnectBaseDelayMs(), 1L);
        long reconnectMax = sanitizeLong(file.reconnectMaxDelayMs(), defaults.reconnectMaxDelayMs(), reconnectBase);
        if (reconnectMax < reconnectBase) {
            reconnectMax = reconnectBase;
        }
        double multiplier = file.backoffMultiplier() == null
                ? defaults.backoffMultiplier()
                : Math.max(1.0d, file.backoffMultiplier());
        return new SyncSettings(
                sanitizeUrl(file.storageBaseUrl(), defaults.storageBaseUrl()),
                sanitizeUrl(file.apiBaseUrl(), defaults.apiBaseUrl()),
                sanitizeUrl(file.syncBaseUrl(), defaults.syncBaseUrl()),
                sanitizeInt(file.downloadMaxAttempts(), defaults.downloadMaxAttempts(), 1),
                downloadBase,
                downloadMax,
                multiplier,
                sanitizeInt(file.downloadChunkBytes(), defaults.downloadChunkBytes(), 1_024),
                sanitizeLong(file.requestTimeoutMs(), defaults.requestTimeoutMs(), 100L),
                reconnectBase,
                reconnectMax,
                sanitizeInt(file.reconnectAttemptCeiling(), defaults.reconnectAttemptCeiling(), 1),
                sanitizeLong(file.heartbeatIntervalMs(), defaults.heartbeatIntervalMs(), 100L),
                sanitizeLong(file.subscriptionDebounceMs(), defaults.subscriptionDebounceMs(), 0L),
                sanitizeInt(file.initializeThreads(), defaults.initializeThreads(), 1)
        );
    }

    public Backoff downloadBackoff() {
        return new Backoff(downloadBaseDelayMs, downloadMaxDelayMs, backoffMultiplier);
    }

    public Backoff reconnectBackoff() {
        return new Backoff(reconnectBaseDelayMs, reconnectMaxDelayMs, backoffMultiplier);
    }

    public Duration requestTimeout() {
        return Duration.ofMillis(requestTimeoutMs);
    }

    public SyncSettings withUrls(String storage, String api, String sync) {
        return new SyncSettings(
                sanitizeUrl(storage, storageBaseUrl),
                sanitizeUrl(api, apiBaseUrl),
                sanitizeUrl(sync, syncBaseUrl),
                downloadMaxAttempts,
                downloadBaseDelayMs,
                downloadMaxDelayMs,
                backoffMultiplier,
                downloadChunkBytes,
                requestTimeoutMs,
                reconnectBaseDelayMs,
                reconnectMaxDelayMs,
                reconnectAttemptCeiling,
                heartbeatIntervalMs,
                subscriptionDebounceMs,
                initializeThreads
        );
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String sanitizeUrl(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String trimmed = raw.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.isBlank() ? fallback : trimmed;
    }

    record SettingsFile(
            String storageBaseUrl,
            String apiBaseUrl,
            String syncBaseUrl,
            Integer downloadMaxAttempts,
            Long downloadBaseDelayMs,
            Long downloadMaxDelayMs,
            Double backoffMultiplier,
            Integer downloadChunkBytes,
            Long requestTimeoutMs,
            Long reconnectBaseDelayMs,
            Long reconnectMaxDelayMs,
            Integer reconnectAttemptCeiling,
            Long heartbeatIntervalMs,
            Long subscriptionDebounceMs,
            Integer initializeThreads
    ) {
    }
}
