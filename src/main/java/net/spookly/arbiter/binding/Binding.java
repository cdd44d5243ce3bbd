package net.spookly.arbiter.binding;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.arbiter.config.ArbiterConfig;
import net.spookly.arbiter.util.PathTemplate;
import net.spookly.arbiter.util.RequestPaths;

/**
 * Immutable routing rule: which methods and paths it governs and how it resolves conflicts.
 */
@Getter
@Accessors(fluent = true)
public final class Binding {
    private final String id;
    private final int priority;
    private final Set<String> methods;
    private final List<String> exactPaths;
    private final List<Pattern> pathRegexes;
    private final List<PathTemplate> pathTemplates;
    private final List<String> intentHints;
    private final Sensitivity sensitivity;
    private final ConflictPolicy conflictPolicy;
    private final String expectedRoute;
    private final boolean fallback;

    public Binding(String id,
                   int priority,
                   Collection<String> methods,
                   Collection<String> exactPaths,
                   Collection<String> pathRegexes,
                   Collection<String> pathTemplates,
                   Collection<String> intentHints,
                   Sensitivity sensitivity,
                   ConflictPolicy conflictPolicy,
                   String expectedRoute,
                   boolean fallback) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("binding id is required");
        }
        this.id = id;
        this.priority = priority;
        this.methods = normalizeMethods(methods);
        this.exactPaths = normalizePaths(exactPaths);
        this.pathRegexes = compileRegexes(pathRegexes);
        this.pathTemplates = compileTemplates(pathTemplates);
        this.intentHints = normalizeHints(intentHints);
        this.sensitivity = sensitivity == null ? Sensitivity.NON_SENSITIVE : sensitivity;
        this.conflictPolicy = Objects.requireNonNull(conflictPolicy, "conflictPolicy");
        this.expectedRoute = expectedRoute;
        this.fallback = fallback;
    }

    /**
     * Build a binding from its config entry.
     */
    public static Binding fromConfig(ArbiterConfig.BindingConfig config) {
        Objects.requireNonNull(config, "config");
        return new Binding(
                config.id,
                config.priority == null ? 0 : config.priority,
                config.methods,
                config.exactPaths,
                config.pathRegexes,
                config.pathTemplates,
                config.intentHints,
                Sensitivity.fromConfig(config.sensitivity),
                ConflictPolicy.fromConfig(config.conflictPolicy, config.rerouteTarget),
                config.expectedRoute,
                config.fallback != null && config.fallback
        );
    }

    public boolean appliesTo(String normalizedMethod) {
        return methods.contains(normalizedMethod);
    }

    /**
     * True when any exact path, regex or template matches the normalized path.
     */
    public boolean matchesPath(String normalizedPath) {
        if (exactPaths.contains(normalizedPath)) {
            return true;
        }
        for (Pattern regex : pathRegexes) {
            if (regex.matcher(normalizedPath).find()) {
                return true;
            }
        }
        for (PathTemplate template : pathTemplates) {
            if (template.matches(normalizedPath)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when any request hint equals one of this binding's hints, ignoring case.
     */
    public boolean matchesIntent(Collection<String> hints) {
        if (hints == null || hints.isEmpty() || intentHints.isEmpty()) {
            return false;
        }
        for (String hint : hints) {
            if (hint != null && intentHints.contains(hint.trim().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Target used when rerouting under this binding: the configured target, else its first exact path,
     * else the path that was requested.
     */
    public String rerouteTargetFor(String requestPath) {
        if (conflictPolicy instanceof ConflictPolicy.RerouteTo) {
            String target = ((ConflictPolicy.RerouteTo) conflictPolicy).target();
            if (target != null) {
                return target;
            }
        }
        if (!exactPaths.isEmpty()) {
            return exactPaths.get(0);
        }
        return requestPath;
    }

    @Override
    public String toString() {
        return "Binding{" + id + ", priority=" + priority + ", policy=" + conflictPolicy + "}";
    }

    private static Set<String> normalizeMethods(Collection<String> raw) {
        Set<String> normalized = new LinkedHashSet<>();
        if (raw != null) {
            for (String method : raw) {
                if (method != null && !method.isBlank()) {
                    normalized.add(RequestPaths.normalizeMethod(method));
                }
            }
        }
        return Set.copyOf(normalized);
    }

    private static List<String> normalizePaths(Collection<String> raw) {
        List<String> normalized = new ArrayList<>();
        if (raw != null) {
            for (String path : raw) {
                if (path != null) {
                    normalized.add(RequestPaths.normalizePath(path));
                }
            }
        }
        return List.copyOf(normalized);
    }

    private static List<Pattern> compileRegexes(Collection<String> raw) {
        List<Pattern> compiled = new ArrayList<>();
        if (raw != null) {
            for (String regex : raw) {
                if (regex != null && !regex.isBlank()) {
                    compiled.add(Pattern.compile(regex));
                }
            }
        }
        return List.copyOf(compiled);
    }

    private static List<PathTemplate> compileTemplates(Collection<String> raw) {
        List<PathTemplate> compiled = new ArrayList<>();
        if (raw != null) {
            for (String template : raw) {
                if (template != null && !template.isBlank()) {
                    compiled.add(PathTemplate.compile(RequestPaths.normalizePath(template)));
                }
            }
        }
        return List.copyOf(compiled);
    }

    private static List<String> normalizeHints(Collection<String> raw) {
        List<String> normalized = new ArrayList<>();
        if (raw != null) {
            for (String hint : raw) {
                if (hint != null && !hint.isBlank()) {
                    normalized.add(hint.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return List.copyOf(normalized);
    }
}
