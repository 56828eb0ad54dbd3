package io.captionsync.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.UUID;

public final class SyncClientConfig {
    public static final String DEFAULT_ROOT = "captionsync-data";
    public static final String SETTINGS_FILE_NAME = "captionsync-settings.json";
    public static final String DEFAULT_STORAGE_BASE_URL = "http://localhost:9000/storage";
    public static final String DEFAULT_API_BASE_URL = "http://localhost:8080/api";
    public static final String DEFAULT_SYNC_BASE_URL = "ws://localhost:8080/api";
    public static final int DEFAULT_DOWNLOAD_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_DOWNLOAD_BASE_DELAY_MS = 1_000L;
    public static final long DEFAULT_DOWNLOAD_MAX_DELAY_MS = 10_000L;
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0d;
    public static final int DEFAULT_DOWNLOAD_CHUNK_BYTES = 64 * 1024;
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_RECONNECT_BASE_DELAY_MS = 1_000L;
    public static final long DEFAULT_RECONNECT_MAX_DELAY_MS = 30_000L;
    public static final int DEFAULT_RECONNECT_ATTEMPT_CEILING = 10;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_SUBSCRIPTION_DEBOUNCE_MS = 0L;
    public static final int DEFAULT_INITIALIZE_THREADS = 4;

    private final Path rootDir;
    private final String clientId;

    public SyncClientConfig(Path rootDir, String clientId) {
        this.rootDir = rootDir;
        this.clientId = clientId;
    }

    public static SyncClientConfig fromRoot(String root) {
        return fromRoot(root, null);
    }

    public static SyncClientConfig fromRoot(String root, String clientId) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new SyncClientConfig(resolved.toAbsolutePath().normalize(), sanitizeClientId(clientId));
    }

    static String sanitizeClientId(String raw) {
        if (raw == null || raw.isBlank()) {
            return "tab-" + UUID.randomUUID();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        return sb.toString();
    }

    public Path rootDir() {
        return rootDir;
    }

    /**
     * Opaque id this client presents to the lock and sync services.
     */
    public String clientId() {
        return clientId;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path cacheDir() {
        return rootDir.resolve("cache");
    }

    public Path workDir() {
        return rootDir.resolve("work");
    }

    public Path eventLogDir() {
        return rootDir.resolve("events");
    }

    public Path eventLogFile() {
        return eventLogDir().resolve("sync-events.jsonl");
    }

    public Path metadataFile() {
        return rootDir.resolve("instances.json");
    }
}
