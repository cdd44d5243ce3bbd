package net.spookly.arbiter.admission;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Downstream compute provider behind the admission governor.
 */
public interface ProviderClient {
    /**
     * Forward a single payload.
     */
    CompletableFuture<JsonNode> call(JsonNode payload);

    /**
     * Forward several payloads in one call; results must line up with {@code payloads} by index.
     */
    CompletableFuture<List<JsonNode>> batch(List<JsonNode> payloads);
}
