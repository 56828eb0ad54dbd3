package io.captionsync.model;

import java.util.Locale;

public enum LockState {
    RELEASED,
    PENDING,
    GRANTED,
    TRANSFERRING;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LockState fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return RELEASED;
        }
        for (LockState value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown lock state: " + raw);
    }
}
