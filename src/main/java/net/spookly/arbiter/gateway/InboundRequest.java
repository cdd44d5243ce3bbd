package net.spookly.arbiter.gateway;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Inbound API request as seen by the gateway.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class InboundRequest {
    private final String method;
    private final String path;
    private final List<String> intentHints;
    /**
     * Verbatim payload text; null when the request forwards nothing to the provider.
     */
    private final String requestKey;
    private final JsonNode payload;

    /**
     * Derive intent hints and request key from a JSON body.
     */
    public static InboundRequest fromBody(String method, String path, JsonNode body) {
        return new InboundRequest(method, path, RequestBodies.intentHints(body), RequestBodies.requestKey(body), body);
    }
}
