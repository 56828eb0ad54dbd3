package io.captionsync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.captionsync.model.ChangeRecord;
import io.captionsync.model.ChangeSet;
import io.captionsync.util.Jsons;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON frames exchanged with the sync endpoint.
 */
public final class SyncFrames {
    public static final String CHANGES = "changes";
    public static final String ACK = "ack";
    public static final String LOCK = "lock";
    public static final String SESSION_TRANSFERRED = "session_transferred";
    public static final String ERROR = "error";
    public static final String PING = "ping";
    public static final String PONG = "pong";

    private SyncFrames() {
    }

    public static String changes(Outbound frame) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("type", CHANGES);
        node.put("messageId", frame.messageId());
        node.set("changes", Jsons.mapper().valueToTree(frame.changes().records()));
        node.put("baseVersion", frame.baseVersion());
        node.put("version", frame.version());
        return Jsons.toCompactJson(node);
    }

    public static String ping() {
        return "{\"type\":\"ping\"}";
    }

    public static Inbound parse(String text) throws IOException {
        JsonNode node = Jsons.mapper().readTree(text);
        if (node == null || !node.isObject()) {
            throw new IOException("Sync frame is not a JSON object");
        }
        String type = node.path("type").asText("");
        if (type.isBlank()) {
            throw new IOException("Sync frame has no type");
        }
        return new Inbound(type, node);
    }

    public static ChangeSet changeSet(JsonNode body, long fallbackBase) {
        List<ChangeRecord> records = new ArrayList<>();
        for (JsonNode item : body.path("changes")) {
            records.add(Jsons.mapper().convertValue(item, ChangeRecord.class));
        }
        long base = body.path("baseVersion").asLong(fallbackBase);
        long version = body.path("version").asLong(base);
        return new ChangeSet(base, version, records);
    }

    public record Outbound(String messageId, ChangeSet changes, long baseVersion) {
        public long version() {
            return changes.resultingVersion();
        }
    }

    public record Inbound(String type, JsonNode body) {
    }
}
