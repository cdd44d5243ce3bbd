package net.spookly.arbiter.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import net.spookly.arbiter.util.RequestPaths;

/**
 * Collects non-fatal configuration warnings (for example, bindings that can only be told apart by id).
 */
public final class ConfigWarnings {
    private ConfigWarnings() {
    }

    public static List<String> collect(ArbiterConfig config) {
        List<String> warnings = new ArrayList<>();
        if (config == null || config.dispatch == null || config.dispatch.bindings == null) {
            return warnings;
        }
        List<ArbiterConfig.BindingConfig> bindings = new ArrayList<>();
        for (ArbiterConfig.BindingConfig binding : config.dispatch.bindings) {
            if (binding != null) {
                bindings.add(binding);
            }
        }
        Set<String> exactTargets = new HashSet<>();
        for (ArbiterConfig.BindingConfig binding : bindings) {
            if (binding.exactPaths != null) {
                for (String path : binding.exactPaths) {
                    exactTargets.add(RequestPaths.normalizePath(path));
                }
            }
        }

        for (int i = 0; i < bindings.size(); i++) {
            ArbiterConfig.BindingConfig left = bindings.get(i);
            for (int j = i + 1; j < bindings.size(); j++) {
                ArbiterConfig.BindingConfig right = bindings.get(j);
                if (left.priority != null && left.priority.equals(right.priority) && sharesMethod(left, right)) {
                    warnings.add("dispatch.bindings " + left.id + " and " + right.id
                            + " share priority " + left.priority + "; conflicts between them resolve by id order");
                }
            }
        }
        for (ArbiterConfig.BindingConfig binding : bindings) {
            if ("sensitive".equalsIgnoreCase(binding.sensitivity)
                    && "refresh_then_reroute".equalsIgnoreCase(binding.conflictPolicy)) {
                warnings.add("dispatch.bindings." + binding.id + " is sensitive but reroutes on conflict");
            }
            if (binding.rerouteTarget != null && !binding.rerouteTarget.isBlank()
                    && !exactTargets.contains(RequestPaths.normalizePath(binding.rerouteTarget))) {
                warnings.add("dispatch.bindings." + binding.id + ".rerouteTarget is not an exact path of any binding: "
                        + binding.rerouteTarget);
            }
        }
        return warnings;
    }

    private static boolean sharesMethod(ArbiterConfig.BindingConfig left, ArbiterConfig.BindingConfig right) {
        if (left.methods == null || right.methods == null) {
            return false;
        }
        Set<String> leftMethods = new HashSet<>();
        for (String method : left.methods) {
            leftMethods.add(RequestPaths.normalizeMethod(method));
        }
        for (String method : right.methods) {
            if (leftMethods.contains(RequestPaths.normalizeMethod(method))) {
                return true;
            }
        }
        return false;
    }
}
