package net.spookly.arbiter.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class EnvExpanderTest {
    @Test
    void expandsEnvironmentValuesInNestedStructures() {
        Map<String, Object> admission = new LinkedHashMap<>();
        admission.put("rateLimitPerMinute", "env:ARBITER_RATE");
        admission.put("batchEndpointPath", "/batch");
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("admission", admission);
        root.put("list", List.of("env:ARBITER_RATE", 7));

        Object expanded = EnvExpander.expand(root, null, key -> "ARBITER_RATE".equals(key) ? "12" : null);

        Map<?, ?> result = (Map<?, ?>) expanded;
        assertEquals("12", ((Map<?, ?>) result.get("admission")).get("rateLimitPerMinute"));
        assertEquals("/batch", ((Map<?, ?>) result.get("admission")).get("batchEndpointPath"));
        assertEquals(List.of("12", 7), result.get("list"));
    }

    @Test
    void missingEnvironmentVariableFails() {
        ConfigException exception = assertThrows(ConfigException.class,
                () -> EnvExpander.expand("env:ARBITER_MISSING", null, key -> null));
        assertEquals("Missing required environment variable: ARBITER_MISSING", exception.getMessage());
    }

    @Test
    void unsetVariableUsesInlineFallback() {
        assertEquals("/ask", EnvExpander.expand("env:ARBITER_TARGET:/ask", null, key -> null));
        assertEquals("/chat", EnvExpander.expand("env:ARBITER_TARGET:/ask", null, key -> "/chat"));
        assertEquals("", EnvExpander.expand("env:ARBITER_TARGET:", null, key -> null));
    }

    @Test
    void emptyPathValueFails() {
        assertThrows(ConfigException.class, () -> EnvExpander.expand("path:", null, key -> null));
    }
}
