package net.spookly.arbiter.binding;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import net.spookly.arbiter.config.ArbiterConfig;
import net.spookly.arbiter.config.ConfigException;

/**
 * Holds the current binding set, its exemptions and the memoized bindings version.
 * <p>
 * The set is immutable once loaded; {@link #reload} swaps bindings, exemptions and the version memo
 * in a single reference update so readers never see a mix of old and new entries.
 */
public class BindingRegistry {
    private final AtomicReference<Snapshot> current = new AtomicReference<>();

    public BindingRegistry(List<Binding> bindings, List<ExemptRoute> exemptRoutes) {
        current.set(Snapshot.of(bindings, exemptRoutes));
    }

    /**
     * Build a registry from the dispatch section of the config.
     */
    public static BindingRegistry fromConfig(ArbiterConfig config) {
        return new BindingRegistry(bindingsFrom(config), exemptRoutesFrom(config));
    }

    /**
     * Replace the whole binding set atomically.
     */
    public void reload(List<Binding> bindings, List<ExemptRoute> exemptRoutes) {
        current.set(Snapshot.of(bindings, exemptRoutes));
    }

    public void reload(ArbiterConfig config) {
        reload(bindingsFrom(config), exemptRoutesFrom(config));
    }

    public List<Binding> bindings() {
        return current.get().bindings;
    }

    public List<ExemptRoute> exemptRoutes() {
        return current.get().exemptRoutes;
    }

    /**
     * Catch-all binding used when no other binding matches.
     */
    public Binding fallback() {
        return current.get().fallback;
    }

    public Binding find(String bindingId) {
        if (bindingId == null) {
            return null;
        }
        for (Binding binding : current.get().bindings) {
            if (bindingId.equals(binding.id())) {
                return binding;
            }
        }
        return null;
    }

    /**
     * Memoized content hash of the current binding set.
     */
    public String bindingsVersion() {
        return current.get().version();
    }

    /**
     * Recompute the content hash, replace the memo and return the fresh value.
     */
    public String refreshBindingsVersion() {
        return current.get().recompute();
    }

    /**
     * Consistent view of bindings and exemptions for one dispatch.
     */
    public Snapshot snapshot() {
        return current.get();
    }

    private static List<Binding> bindingsFrom(ArbiterConfig config) {
        if (config == null || config.dispatch == null || config.dispatch.bindings == null) {
            throw new ConfigException("dispatch.bindings is required");
        }
        List<Binding> bindings = new ArrayList<>();
        for (ArbiterConfig.BindingConfig binding : config.dispatch.bindings) {
            if (binding == null) {
                continue;
            }
            try {
                bindings.add(Binding.fromConfig(binding));
            } catch (IllegalArgumentException e) {
                throw new ConfigException("Invalid binding " + binding.id + ": " + e.getMessage(), e);
            }
        }
        return bindings;
    }

    private static List<ExemptRoute> exemptRoutesFrom(ArbiterConfig config) {
        List<ExemptRoute> routes = new ArrayList<>();
        if (config == null || config.dispatch == null || config.dispatch.exemptRoutes == null) {
            return routes;
        }
        for (ArbiterConfig.ExemptRouteConfig exempt : config.dispatch.exemptRoutes) {
            if (exempt == null) {
                continue;
            }
            if (exempt.exactPath != null && !exempt.exactPath.isBlank()) {
                routes.add(ExemptRoute.exact(exempt.method, exempt.exactPath));
            } else {
                routes.add(ExemptRoute.prefix(exempt.method, exempt.prefixPath));
            }
        }
        return routes;
    }

    public static final class Snapshot {
        private final List<Binding> bindings;
        private final List<ExemptRoute> exemptRoutes;
        private final Binding fallback;
        private volatile String version;

        private Snapshot(List<Binding> bindings, List<ExemptRoute> exemptRoutes, Binding fallback) {
            this.bindings = bindings;
            this.exemptRoutes = exemptRoutes;
            this.fallback = fallback;
        }

        static Snapshot of(List<Binding> bindings, List<ExemptRoute> exemptRoutes) {
            Objects.requireNonNull(bindings, "bindings");
            Set<String> ids = new HashSet<>();
            Binding fallback = null;
            for (Binding binding : bindings) {
                Objects.requireNonNull(binding, "binding");
                if (!ids.add(binding.id())) {
                    throw new IllegalArgumentException("duplicate binding id: " + binding.id());
                }
                if (binding.fallback()) {
                    if (fallback != null) {
                        throw new IllegalArgumentException("more than one fallback binding: "
                                + fallback.id() + ", " + binding.id());
                    }
                    fallback = binding;
                }
            }
            if (fallback == null) {
                throw new IllegalArgumentException("registry requires a fallback binding");
            }
            for (Binding binding : bindings) {
                if (binding.priority() < fallback.priority()) {
                    throw new IllegalArgumentException("fallback binding must have the lowest priority, but "
                            + binding.id() + " is lower");
                }
            }
            return new Snapshot(
                    List.copyOf(bindings),
                    exemptRoutes == null ? List.of() : List.copyOf(exemptRoutes),
                    fallback
            );
        }

        public List<Binding> bindings() {
            return bindings;
        }

        public List<ExemptRoute> exemptRoutes() {
            return exemptRoutes;
        }

        public Binding fallback() {
            return fallback;
        }

        public String version() {
            String memo = version;
            if (memo == null) {
                memo = BindingsVersion.compute(bindings);
                version = memo;
            }
            return memo;
        }

        String recompute() {
            String fresh = BindingsVersion.compute(bindings);
            version = fresh;
            return fresh;
        }
    }
}
