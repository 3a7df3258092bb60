package io.sessionkeeper.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sessionkeeper.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scrubs credentials out of structured event data before it reaches disk.
 *
 * <p>Keys are split into word segments ({@code api_key}, {@code apiKey}, {@code x-auth-token}) so that
 * ordinary fields such as {@code key} or {@code keywords} pass through untouched.
 */
public final class SensitiveDataMasker {
    public static final String MASK = "***";
    private static final Set<String> SENSITIVE_SEGMENTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "credential", "credentials", "apikey"
    );
    private static final Set<String> SENSITIVE_PAIRS = Set.of("api_key", "access_key", "private_key", "secret_key");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("^(sk|pk|ghp|xox[abp])[-_][A-Za-z0-9_\\-]{16,}$");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Jsons.mapper().createObjectNode();
        }
        JsonNode tree = Jsons.mapper().valueToTree(data);
        return masked(tree);
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
                if (isSensitiveKey(entry.getKey())) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), masked(entry.getValue()));
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
        if (input.isTextual() && OPAQUE_TOKEN.matcher(input.asText("").trim()).matches()) {
            return Jsons.mapper().getNodeFactory().textNode(MASK);
        }
        return input;
    }

    static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String snake = CAMEL_BOUNDARY.matcher(rawKey.trim()).replaceAll("$1_$2").toLowerCase(Locale.ROOT);
        String[] segments = snake.split("[^a-z0-9]+");
        for (int i = 0; i < segments.length; i++) {
            if (SENSITIVE_SEGMENTS.contains(segments[i])) {
                return true;
            }
            if (i + 1 < segments.length && SENSITIVE_PAIRS.contains(segments[i] + "_" + segments[i + 1])) {
                return true;
            }
        }
        return false;
    }
}
