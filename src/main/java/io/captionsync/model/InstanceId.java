package io.captionsync.model;

/**
 * Key of one replicated database: the video it belongs to and which of its databases.
 */
public record InstanceId(String videoId, DatabaseName databaseName) {

    public InstanceId {
        if (videoId == null || videoId.isBlank()) {
            throw new IllegalArgumentException("videoId must not be blank");
        }
        if (videoId.contains(":")) {
            throw new IllegalArgumentException("videoId must not contain ':': " + videoId);
        }
        if (databaseName == null) {
            throw new IllegalArgumentException("databaseName must not be null");
        }
        videoId = videoId.trim();
    }

    public static InstanceId of(String videoId, String databaseName) {
        return new InstanceId(videoId, DatabaseName.fromString(databaseName));
    }

    public static InstanceId parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("instance id must not be null");
        }
        int split = raw.lastIndexOf(':');
        if (split <= 0 || split == raw.length() - 1) {
            throw new IllegalArgumentException("Malformed instance id: " + raw);
        }
        return of(raw.substring(0, split), raw.substring(split + 1));
    }

    public String value() {
        return videoId + ":" + databaseName.wireName();
    }

    @Override
    public String toString() {
        return value();
    }
}
