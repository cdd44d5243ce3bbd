package net.spookly.arbiter.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class ConfigWarningsTest {
    @Test
    void warnsOnEqualPrioritySharingMethod() {
        ArbiterConfig config = ConfigValidatorTest.minimalConfig();
        config.dispatch.bindings.add(ConfigValidatorTest.binding("answer", 10, "/answer"));

        List<String> warnings = ConfigWarnings.collect(config);

        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).contains("ask and answer share priority 10"));
    }

    @Test
    void equalPriorityOnDisjointMethodsIsQuiet() {
        ArbiterConfig config = ConfigValidatorTest.minimalConfig();
        ArbiterConfig.BindingConfig other = ConfigValidatorTest.binding("status", 10, "/status");
        other.methods = List.of("GET");
        config.dispatch.bindings.add(other);

        assertTrue(ConfigWarnings.collect(config).isEmpty());
    }

    @Test
    void warnsOnSensitiveRerouteAndDanglingTarget() {
        ArbiterConfig config = ConfigValidatorTest.minimalConfig();
        ArbiterConfig.BindingConfig ask = config.dispatch.bindings.get(0);
        ask.sensitivity = "sensitive";
        ask.conflictPolicy = "refresh_then_reroute";
        ask.rerouteTarget = "/nowhere";

        List<String> warnings = ConfigWarnings.collect(config);

        assertTrue(warnings.stream().anyMatch(message -> message.contains("ask is sensitive but reroutes on conflict")));
        assertTrue(warnings.stream().anyMatch(message -> message.contains("not an exact path of any binding: /nowhere")));
    }
}
