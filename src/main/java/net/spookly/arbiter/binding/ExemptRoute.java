package net.spookly.arbiter.binding;

import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.arbiter.util.RequestPaths;

/**
 * Method and path (exact or prefix) that bypasses conflict evaluation entirely.
 */
@Getter
@Accessors(fluent = true)
public final class ExemptRoute {
    private final String method;
    private final String exactPath;
    private final String prefixPath;

    private ExemptRoute(String method, String exactPath, String prefixPath) {
        this.method = RequestPaths.normalizeMethod(method);
        this.exactPath = exactPath == null ? null : RequestPaths.normalizePath(exactPath);
        this.prefixPath = prefixPath == null ? null : RequestPaths.normalizePath(prefixPath);
    }

    public static ExemptRoute exact(String method, String path) {
        return new ExemptRoute(method, path, null);
    }

    public static ExemptRoute prefix(String method, String prefix) {
        return new ExemptRoute(method, null, prefix);
    }

    /**
     * Match a normalized method and path.
     */
    public boolean matches(String normalizedMethod, String normalizedPath) {
        if (!method.equals(normalizedMethod)) {
            return false;
        }
        if (exactPath != null && exactPath.equals(normalizedPath)) {
            return true;
        }
        return prefixPath != null && RequestPaths.hasPrefixBoundary(normalizedPath, prefixPath);
    }

    @Override
    public String toString() {
        return method + " " + (exactPath != null ? exactPath : prefixPath + "*");
    }
}
