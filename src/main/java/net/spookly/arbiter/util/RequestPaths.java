package net.spookly.arbiter.util;

import java.util.Locale;

/**
 * Normalizes HTTP methods and request paths before matching.
 */
public final class RequestPaths {
    private RequestPaths() {
    }

    /**
     * Upper-case and trim a method; null becomes an empty string.
     */
    public static String normalizeMethod(String method) {
        if (method == null) {
            return "";
        }
        return method.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Trim a path, map blank to {@code /} and ensure a leading slash.
     */
    public static String normalizePath(String path) {
        if (path == null) {
            return "/";
        }
        String trimmed = path.trim();
        if (trimmed.isEmpty()) {
            return "/";
        }
        return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
    }

    /**
     * True when {@code path} equals {@code prefix} or continues it past a slash boundary.
     */
    public static boolean hasPrefixBoundary(String path, String prefix) {
        if (path == null || prefix == null) {
            return false;
        }
        if (path.equals(prefix)) {
            return true;
        }
        if (prefix.endsWith("/")) {
            return path.startsWith(prefix);
        }
        return path.startsWith(prefix + "/");
    }
}
