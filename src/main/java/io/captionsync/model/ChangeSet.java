package io.captionsync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ChangeSet(
        @JsonProperty("origin_version") long originVersion,
        @JsonProperty("resulting_version") long resultingVersion,
        @JsonProperty("records") List<ChangeRecord> records
) {

    public ChangeSet {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static ChangeSet empty(long version) {
        return new ChangeSet(version, version, List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }
}
