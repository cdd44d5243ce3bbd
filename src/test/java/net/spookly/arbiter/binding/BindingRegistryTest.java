package net.spookly.arbiter.binding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import net.spookly.arbiter.config.ConfigDefaults;
import net.spookly.arbiter.config.ConfigLoader;
import org.junit.jupiter.api.Test;

class BindingRegistryTest {
    @Test
    void buildsFromDefaultConfig() {
        BindingRegistry registry = BindingRegistry.fromConfig(ConfigLoader.parse(ConfigDefaults.defaultYaml(), null));

        assertEquals(3, registry.bindings().size());
        assertEquals("catch-all", registry.fallback().id());
        assertNotNull(registry.find("api-family"));
        assertNull(registry.find("missing"));
        assertTrue(registry.exemptRoutes().get(0).matches("GET", "/health/live"));
    }

    @Test
    void requiresSingleLowestPriorityFallback() {
        Binding ask = ask(10);
        assertThrows(IllegalArgumentException.class, () -> new BindingRegistry(List.of(ask), List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new BindingRegistry(List.of(ask, BindingsVersionTest.fallback(20)), List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new BindingRegistry(List.of(ask, ask(11), BindingsVersionTest.fallback(1)), List.of()));
    }

    @Test
    void reloadSwapsSnapshotAndVersion() {
        BindingRegistry registry = new BindingRegistry(List.of(ask(10), BindingsVersionTest.fallback(1)), List.of());
        BindingRegistry.Snapshot before = registry.snapshot();
        String versionBefore = registry.bindingsVersion();

        registry.reload(List.of(ask(30), BindingsVersionTest.fallback(1)),
                List.of(ExemptRoute.exact("GET", "/status")));

        assertEquals(10, before.bindings().get(0).priority());
        assertEquals(30, registry.find("ask").priority());
        assertEquals(1, registry.exemptRoutes().size());
        assertNotEquals(versionBefore, registry.bindingsVersion());
    }

    @Test
    void refreshReturnsSameHashForUnchangedSet() {
        BindingRegistry registry = new BindingRegistry(List.of(ask(10), BindingsVersionTest.fallback(1)), List.of());
        String memo = registry.bindingsVersion();

        assertEquals(memo, registry.refreshBindingsVersion());
        assertEquals(memo, registry.bindingsVersion());
    }

    private static Binding ask(int priority) {
        return new Binding("ask", priority, List.of("POST"), List.of("/ask"), List.of(), List.of(), List.of(),
                null, ConflictPolicy.strictBlock(), null, false);
    }
}
