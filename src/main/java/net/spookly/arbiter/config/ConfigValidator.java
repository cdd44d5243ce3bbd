package net.spookly.arbiter.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(ArbiterConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateDispatch(config, errors);
        validateAdmission(config, errors);

        throwIfErrors(errors);
    }

    private static void validateDispatch(ArbiterConfig config, List<String> errors) {
        ArbiterConfig.DispatchConfig dispatch = config.dispatch;
        if (dispatch == null) {
            errors.add("dispatch section is required");
            return;
        }
        if (dispatch.exemptRoutes != null) {
            for (ArbiterConfig.ExemptRouteConfig exempt : dispatch.exemptRoutes) {
                if (exempt == null) {
                    continue;
                }
                requireNonBlank(errors, exempt.method, "dispatch.exemptRoutes.method");
                boolean hasExact = !isBlank(exempt.exactPath);
                boolean hasPrefix = !isBlank(exempt.prefixPath);
                if (hasExact == hasPrefix) {
                    errors.add("dispatch.exemptRoutes entries need exactly one of exactPath or prefixPath");
                }
            }
        }
        if (dispatch.bindings == null || dispatch.bindings.isEmpty()) {
            errors.add("dispatch.bindings must include at least one binding");
            return;
        }

        Set<String> ids = new HashSet<>();
        List<ArbiterConfig.BindingConfig> fallbacks = new ArrayList<>();
        for (ArbiterConfig.BindingConfig binding : dispatch.bindings) {
            if (binding == null) {
                errors.add("dispatch.bindings must not include empty entries");
                continue;
            }
            String label = "dispatch.bindings." + (isBlank(binding.id) ? "<unnamed>" : binding.id);
            if (isBlank(binding.id)) {
                errors.add("dispatch.bindings.id is required");
            } else if (!ids.add(binding.id)) {
                errors.add("dispatch.bindings.id must be unique: " + binding.id);
            }
            if (binding.priority == null) {
                errors.add(label + ".priority is required");
            }
            if (binding.methods == null || binding.methods.isEmpty()) {
                errors.add(label + ".methods must include at least one method");
            } else {
                for (String method : binding.methods) {
                    if (isBlank(method)) {
                        errors.add(label + ".methods must not include blank entries");
                    }
                }
            }
            boolean fallback = isTrue(binding.fallback);
            if (fallback) {
                fallbacks.add(binding);
            }
            if (!fallback && isEmpty(binding.exactPaths) && isEmpty(binding.pathRegexes)
                    && isEmpty(binding.pathTemplates) && isEmpty(binding.intentHints)) {
                errors.add(label + " must declare at least one exact path, regex, template or intent hint");
            }
            if (binding.pathRegexes != null) {
                for (String regex : binding.pathRegexes) {
                    if (isBlank(regex)) {
                        errors.add(label + ".pathRegexes must not include blank entries");
                        continue;
                    }
                    try {
                        Pattern.compile(regex);
                    } catch (PatternSyntaxException e) {
                        errors.add(label + ".pathRegexes has invalid pattern: " + regex);
                    }
                }
            }
            if (!isBlank(binding.sensitivity) && !isOneOf(binding.sensitivity, "sensitive", "non-sensitive")) {
                errors.add(label + ".sensitivity must be sensitive or non-sensitive");
            }
            requireNonBlank(errors, binding.conflictPolicy, label + ".conflictPolicy");
            if (!isBlank(binding.conflictPolicy)
                    && !isOneOf(binding.conflictPolicy, "strict_block", "refresh_then_reroute")) {
                errors.add(label + ".conflictPolicy must be strict_block or refresh_then_reroute");
            }
            if (isOneOf(binding.conflictPolicy, "strict_block") && !isBlank(binding.rerouteTarget)) {
                errors.add(label + ".rerouteTarget is not allowed with conflictPolicy strict_block");
            }
        }

        if (fallbacks.isEmpty()) {
            errors.add("dispatch.bindings must mark exactly one binding as fallback");
        } else if (fallbacks.size() > 1) {
            errors.add("dispatch.bindings must mark exactly one binding as fallback, found " + fallbacks.size());
        } else {
            ArbiterConfig.BindingConfig fallback = fallbacks.get(0);
            if (fallback.priority != null) {
                for (ArbiterConfig.BindingConfig binding : dispatch.bindings) {
                    if (binding != null && binding != fallback && binding.priority != null
                            && binding.priority < fallback.priority) {
                        errors.add("dispatch.bindings fallback must have the lowest priority, but "
                                + binding.id + " is lower");
                    }
                }
            }
        }
    }

    private static void validateAdmission(ArbiterConfig config, List<String> errors) {
        ArbiterConfig.AdmissionConfig admission = config.admission;
        if (admission == null) {
            return;
        }
        requirePositiveIfPresent(errors, admission.rateLimitPerMinute, "admission.rateLimitPerMinute");
        requirePositiveIfPresent(errors, admission.cacheTtlMs, "admission.cacheTtlMs");
        requirePositiveIfPresent(errors, admission.batchWindowMs, "admission.batchWindowMs");
        requirePositiveIfPresent(errors, admission.requestTimeoutMs, "admission.requestTimeoutMs");
        if (admission.batchEndpointPath != null && isBlank(admission.batchEndpointPath)) {
            errors.add("admission.batchEndpointPath must not be blank");
        }
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static void requirePositiveIfPresent(List<String> errors, Integer value, String field) {
        if (value != null && value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static boolean isEmpty(List<String> values) {
        return values == null || values.isEmpty();
    }

    private static boolean isTrue(Boolean value) {
        return value != null && value;
    }

    private static boolean isOneOf(String value, String... options) {
        if (value == null) {
            return false;
        }
        for (String option : options) {
            if (value.equalsIgnoreCase(option)) {
                return true;
            }
        }
        return false;
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
