package net.spookly.arbiter.dispatch;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Method, path and optional intent hints of an inbound request.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class DispatchRequest {
    private final String method;
    private final String path;
    /**
     * Lower-case classification hints taken from the request body; may be empty.
     */
    private final List<String> intentHints;

    public static DispatchRequest of(String method, String path) {
        return new DispatchRequest(method, path, List.of());
    }
}
