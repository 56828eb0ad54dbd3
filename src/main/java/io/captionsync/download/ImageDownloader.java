package io.captionsync.download;

import io.captionsync.config.SyncSettings;
import io.captionsync.error.DownloadException;
import io.captionsync.error.ErrorCode;
import io.captionsync.model.DownloadProgress;
import io.captionsync.model.InstanceId;
import io.captionsync.observability.SyncEventLog;
import io.captionsync.util.Backoff;
import io.captionsync.util.CancelToken;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;
import java.util.zip.GZIPInputStream;

/**
 * Fetches database images from remote storage with retry and gunzip, falling back to a local cache when offline.
 */
public final class ImageDownloader {
    private final HttpClient http;
    private final SyncSettings settings;
    private final Path cacheDir;
    private final SyncEventLog eventLog;
    private final Backoff backoff;

    public ImageDownloader(HttpClient http, SyncSettings settings, Path cacheDir, SyncEventLog eventLog) {
        this.http = http;
        this.settings = settings;
        this.cacheDir = cacheDir;
        this.eventLog = eventLog;
        this.backoff = settings.downloadBackoff();
    }

    /**
     * Fetches the current image from remote storage. The local cache is only an offline fallback: it is served
     * when every attempt failed on the network or with a retryable status, and never when {@code forceDownload}
     * is set. Nothing is cached here; callers call {@link #cacheImage} once the image has been opened.
     */
    public byte[] download(DownloadRequest request, Consumer<DownloadProgress> onProgress, CancelToken cancel) {
        Consumer<DownloadProgress> progress = onProgress == null ? p -> { } : onProgress;
        CancelToken token = cancel == null ? CancelToken.none() : cancel;
        InstanceId id = request.instanceId();
        URI uri = imageUri(request);
        int maxAttempts = settings.downloadMaxAttempts();
        IOException lastError = null;
        int lastStatus = -1;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            token.throwIfCancelled("Download of " + id);
            try {
                byte[] body = fetch(uri, request, attempt, progress, token);
                byte[] image = maybeDecompress(body, id, attempt, progress);
                progress.accept(DownloadProgress.complete(image.length, attempt));
                eventLog.log("download.complete", id, "ok", Map.of(
                        "attempt", attempt,
                        "bytes", image.length,
                        "compressed_bytes", body.length
                ));
                return image;
            } catch (HttpStatusException e) {
                lastStatus = e.status;
                lastError = null;
                if (!isRetryable(e.status)) {
                    progress.accept(DownloadProgress.failed(attempt, "HTTP " + e.status));
                    eventLog.log("download.failed", id, "http_" + e.status, Map.of("attempt", attempt, "uri", uri.toString()));
                    throw new DownloadException(ErrorCode.DOWNLOAD_FAILED,
                            "Download of " + id + " failed with HTTP " + e.status, id, attempt, e.status, null);
                }
            } catch (IOException e) {
                lastError = e;
                lastStatus = -1;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Download of " + id + " interrupted");
            }
            if (attempt < maxAttempts) {
                long delay = backoff.delayForAttempt(attempt - 1);
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("attempt", attempt);
                details.put("delay_ms", delay);
                details.put("status", lastStatus);
                details.put("error", lastError == null ? "" : String.valueOf(lastError.getMessage()));
                eventLog.log("download.retry", id, "retrying", details);
                token.sleep(delay, "Download of " + id);
            }
        }
        String reason = lastError != null ? lastError.getMessage() : "HTTP " + lastStatus;
        if (!request.forceDownload()) {
            byte[] cached = readCache(request.tenantId(), id);
            if (cached != null) {
                progress.accept(DownloadProgress.complete(cached.length, maxAttempts));
                eventLog.log("download.cache_fallback", id, "offline", Map.of(
                        "attempts", maxAttempts,
                        "bytes", cached.length,
                        "reason", String.valueOf(reason)
                ));
                return cached;
            }
        }
        progress.accept(DownloadProgress.failed(maxAttempts, reason));
        eventLog.log("download.failed", id, "exhausted", Map.of("attempts", maxAttempts, "reason", String.valueOf(reason)));
        throw DownloadException.exhausted(id, maxAttempts, lastStatus, lastError);
    }

    /**
     * Stores an image that opened cleanly as the offline fallback for later downloads.
     * A failed write is logged and otherwise ignored; the cache is never required.
     */
    public void cacheImage(String tenantId, InstanceId id, byte[] image) {
        Path target = cacheFile(tenantId, id);
        try {
            writeCache(target, image);
        } catch (IOException e) {
            eventLog.log("download.cache_write_failed", id, "skipped", Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    public boolean clearCache(String tenantId, InstanceId id) {
        try {
            return Files.deleteIfExists(cacheFile(tenantId, id));
        } catch (IOException e) {
            throw new RuntimeException("Failed to clear cached image for " + id, e);
        }
    }

    public URI imageUri(DownloadRequest request) {
        return URI.create(settings.storageBaseUrl() + "/" + request.storageKey());
    }

    private byte[] readCache(String tenantId, InstanceId id) {
        Path cached = cacheFile(tenantId, id);
        if (!Files.exists(cached)) {
            return null;
        }
        try {
            return Files.readAllBytes(cached);
        } catch (IOException e) {
            eventLog.log("download.cache_read_failed", id, "skipped", Map.of("error", String.valueOf(e.getMessage())));
            return null;
        }
    }

    Path cacheFile(String tenantId, InstanceId id) {
        return cacheDir.resolve(tenantId).resolve(id.videoId()).resolve(id.databaseName().wireName() + ".db");
    }

    private byte[] fetch(URI uri, DownloadRequest request, int attempt, Consumer<DownloadProgress> progress, CancelToken token)
            throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(settings.requestTimeout())
                .GET();
        if (request.authToken() != null && !request.authToken().isBlank()) {
            builder.header("Authorization", "Bearer " + request.authToken());
        }
        HttpResponse<InputStream> response = http.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
        try (InputStream in = response.body()) {
            if (response.statusCode() / 100 != 2) {
                in.readAllBytes();
                throw new HttpStatusException(response.statusCode());
            }
            long total = response.headers().firstValueAsLong("Content-Length").orElse(-1L);
            progress.accept(DownloadProgress.downloading(0L, total, attempt));
            ByteArrayOutputStream out = new ByteArrayOutputStream(total > 0L ? (int) Math.min(total, Integer.MAX_VALUE) : 8192);
            byte[] buffer = new byte[settings.downloadChunkBytes()];
            long received = 0L;
            int read;
            while ((read = in.read(buffer)) != -1) {
                token.throwIfCancelled("Download of " + request.instanceId());
                out.write(buffer, 0, read);
                received += read;
                progress.accept(DownloadProgress.downloading(received, total, attempt));
            }
            return out.toByteArray();
        }
    }

    private byte[] maybeDecompress(byte[] body, InstanceId id, int attempt, Consumer<DownloadProgress> progress) {
        if (!isGzip(body)) {
            return body;
        }
        progress.accept(DownloadProgress.decompressing(body.length, attempt));
        try {
            return gunzip(body, id, attempt);
        } catch (DownloadException e) {
            progress.accept(DownloadProgress.failed(attempt, "decompress failed"));
            throw e;
        }
    }

    public static boolean isGzip(byte[] body) {
        return body.length >= 2 && (body[0] & 0xff) == 0x1f && (body[1] & 0xff) == 0x8b;
    }

    public static byte[] gunzip(byte[] body, InstanceId id, int attempt) {
        try (GZIPInputStream gz = new GZIPInputStream(new ByteArrayInputStream(body))) {
            return gz.readAllBytes();
        } catch (IOException e) {
            throw new DownloadException(ErrorCode.DECOMPRESS_FAILED,
                    "Failed to decompress image for " + id + ": " + e.getMessage(), id, attempt, 200, e);
        }
    }

    private void writeCache(Path target, byte[] image) throws IOException {
        Files.createDirectories(target.getParent());
        Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, image);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    static boolean isRetryable(int status) {
        return status >= 500 || status == 408 || status == 429;
    }

    private static final class HttpStatusException extends IOException {
        private final int status;

        private HttpStatusException(int status) {
            super("HTTP " + status);
            this.status = status;
        }
    }
}
