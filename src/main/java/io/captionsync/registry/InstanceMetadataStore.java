package io.captionsync.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.captionsync.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;

/**
 * Persists which instances were open and at what version. Handles and engine state are never stored.
 */
public final class InstanceMetadataStore {
    private final Path file;

    public InstanceMetadataStore(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public void save(List<Entry> entries) {
        try {
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            try {
                Files.writeString(tmp, Jsons.toJson(new MetadataFile(entries)), StandardCharsets.UTF_8);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to persist instance metadata: " + file, e);
        }
    }

    public List<Entry> load() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            MetadataFile parsed = Jsons.mapper().readValue(file.toFile(), MetadataFile.class);
            return parsed == null || parsed.instances() == null ? List.of() : List.copyOf(parsed.instances());
        } catch (IOException e) {
            throw new RuntimeException("Failed to read instance metadata: " + file, e);
        }
    }

    public record Entry(
            @JsonProperty("instance_id") String instanceId,
            @JsonProperty("version") long version,
            @JsonProperty("initialized_at") Instant initializedAt
    ) {
    }

    record MetadataFile(@JsonProperty("instances") List<Entry> instances) {
    }
}
