package io.captionsync.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.captionsync.model.InstanceId;
import io.captionsync.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL log of instance lifecycle events and failures.
 */
public final class SyncEventLog {
    private final Path logFile;
    private final String clientId;

    public SyncEventLog(Path logFile, String clientId) {
        this.logFile = logFile;
        this.clientId = clientId == null || clientId.isBlank() ? "unknown" : clientId.trim();
        try {
            Files.createDirectories(logFile.getParent());
            if (!Files.exists(logFile)) {
                try {
                    Files.createFile(logFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another client created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize sync event log: " + logFile, e);
        }
    }

    public void log(SyncEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("client_id", clientId);
        row.put("action", event.action());
        row.put("instance_id", event.instanceId() == null ? null : event.instanceId().value());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        synchronized (this) {
            try {
                Files.writeString(logFile, line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            } catch (IOException e) {
                throw new RuntimeException("Failed to write sync event log", e);
            }
        }
    }

    public void log(String action, InstanceId instanceId, String result, Map<String, Object> details) {
        log(SyncEvent.of(action, instanceId, result, details));
    }

    public Path logFile() {
        return logFile;
    }

    public synchronized List<JsonNode> readAll() {
        List<JsonNode> out = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(logFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(Jsons.mapper().readTree(line));
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read sync event log: " + logFile, e);
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, Map.class);
    }

    public record SyncEvent(
            String action,
            InstanceId instanceId,
            String result,
            Map<String, Object> details
    ) {
        public static SyncEvent of(String action, InstanceId instanceId, String result, Map<String, Object> details) {
            return new SyncEvent(action, instanceId, result, details == null ? Map.of() : details);
        }
    }
}
