package net.spookly.arbiter.gateway;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Field extraction from JSON request bodies.
 */
public final class RequestBodies {
    static final List<String> PAYLOAD_FIELDS = List.of("prompt", "message", "userInput", "content", "text", "query");
    static final List<String> INTENT_FIELDS = List.of("domain", "module", "command", "updateType", "source");

    private RequestBodies() {
    }

    /**
     * First non-blank textual payload field, verbatim, or null when the body forwards nothing.
     */
    public static String requestKey(JsonNode body) {
        if (body == null || !body.isObject()) {
            return null;
        }
        for (String field : PAYLOAD_FIELDS) {
            JsonNode value = body.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    /**
     * Trimmed, lower-cased, de-duplicated classification hints.
     */
    public static List<String> intentHints(JsonNode body) {
        if (body == null || !body.isObject()) {
            return List.of();
        }
        Set<String> hints = new LinkedHashSet<>();
        for (String field : INTENT_FIELDS) {
            JsonNode value = body.get(field);
            if (value == null || !value.isTextual()) {
                continue;
            }
            String hint = value.asText().trim().toLowerCase(Locale.ROOT);
            if (!hint.isEmpty()) {
                hints.add(hint);
            }
        }
        return new ArrayList<>(hints);
    }
}
