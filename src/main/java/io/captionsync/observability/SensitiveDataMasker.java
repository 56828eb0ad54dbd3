package io.captionsync.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.captionsync.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks auth tokens and cell values before event details reach disk.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "secret", "token", "authorization", "bearer", "cookie", "credential"
    );
    private static final Pattern UUID_LIKE = Pattern.compile(
            "^([a-z]+-)?[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$");
    private static final Set<String> REDACTED_PAYLOAD_KEYS = Set.of("val", "params", "value");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String key = entry.getKey();
                if (isSensitiveKey(key) || isPayloadKey(key)) {
                    out.put(key, MASK);
                } else {
                    out.set(key, masked(entry.getValue()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual()) {
            return Jsons.mapper().valueToTree(maskText(input.asText("")));
        }
        return input;
    }

    /**
     * Replaces bearer credentials and long opaque strings inside free text.
     */
    public static String maskText(String value) {
        if (value == null) {
            return null;
        }
        String out = value.replaceAll("(?i)bearer\\s+[A-Za-z0-9+/=_\\-.]+", "Bearer " + MASK);
        if (likelySecretValue(out)) {
            return MASK;
        }
        return out;
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isPayloadKey(String rawKey) {
        return rawKey != null && REDACTED_PAYLOAD_KEYS.contains(rawKey.toLowerCase(Locale.ROOT));
    }

    private static boolean likelySecretValue(String value) {
        String v = value.trim();
        if (v.length() < 32 || UUID_LIKE.matcher(v).matches()) {
            return false;
        }
        // Long opaque strings with no separators are treated as credentials.
        return v.matches("^[A-Za-z0-9+/=_\\-.]{32,}$");
    }
}
