package net.spookly.arbiter.config;

import java.util.List;

public class ArbiterConfig {
    public DispatchConfig dispatch;
    public AdmissionConfig admission;

    public static class DispatchConfig {
        public List<ExemptRouteConfig> exemptRoutes;
        public List<BindingConfig> bindings;
    }

    public static class ExemptRouteConfig {
        public String method;
        public String exactPath;
        /**
         * Exempts the prefix itself and any path below it on a slash boundary.
         */
        public String prefixPath;
    }

    public static class BindingConfig {
        public String id;
        public Integer priority;
        public List<String> methods;
        public List<String> exactPaths;
        public List<String> pathRegexes;
        public List<String> pathTemplates;
        public List<String> intentHints;
        public String sensitivity;
        public String conflictPolicy;
        public String rerouteTarget;
        public String expectedRoute;
        /**
         * Marks the catch-all binding used when nothing else matches.
         */
        public Boolean fallback;
    }

    public static class AdmissionConfig {
        public Integer rateLimitPerMinute;
        public Integer cacheTtlMs;
        public Integer batchWindowMs;
        public Integer requestTimeoutMs;
        public String batchEndpointPath;
        public Boolean singleFlight;
    }
}
