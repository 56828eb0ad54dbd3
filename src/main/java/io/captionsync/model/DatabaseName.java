package io.captionsync.model;

import java.util.List;

public enum DatabaseName {
    LAYOUT("layout", List.of("boxes", "layout_config", "preferences")),
    CAPTIONS("captions", List.of("captions"));

    private final String wireName;
    private final List<String> replicatedTables;

    DatabaseName(String wireName, List<String> replicatedTables) {
        this.wireName = wireName;
        this.replicatedTables = replicatedTables;
    }

    public String wireName() {
        return wireName;
    }

    public List<String> replicatedTables() {
        return replicatedTables;
    }

    public static DatabaseName fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("database name must not be blank");
        }
        for (DatabaseName value : values()) {
            if (value.wireName.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown database name: " + raw);
    }
}
