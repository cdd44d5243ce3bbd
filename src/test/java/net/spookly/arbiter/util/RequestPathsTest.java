package net.spookly.arbiter.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class RequestPathsTest {
    @Test
    void normalizesMethodCaseAndWhitespace() {
        assertEquals("POST", RequestPaths.normalizeMethod(" post "));
        assertEquals("", RequestPaths.normalizeMethod(null));
    }

    @Test
    void normalizesPaths() {
        assertEquals("/", RequestPaths.normalizePath(null));
        assertEquals("/", RequestPaths.normalizePath("   "));
        assertEquals("/ask", RequestPaths.normalizePath("ask"));
        assertEquals("/ask", RequestPaths.normalizePath(" /ask "));
    }

    @Test
    void prefixMatchesOnlyAtSegmentBoundary() {
        assertTrue(RequestPaths.hasPrefixBoundary("/health", "/health"));
        assertTrue(RequestPaths.hasPrefixBoundary("/health/live", "/health"));
        assertFalse(RequestPaths.hasPrefixBoundary("/healthz", "/health"));
        assertTrue(RequestPaths.hasPrefixBoundary("/static/app.js", "/static/"));
        assertFalse(RequestPaths.hasPrefixBoundary(null, "/health"));
    }
}
