package net.spookly.arbiter.config;

/**
 * Default configuration template written when no config file exists.
 */
public final class ConfigDefaults {
    public static final int DEFAULT_RATE_LIMIT_PER_MINUTE = 5;
    public static final int DEFAULT_CACHE_TTL_MS = 60_000;
    public static final int DEFAULT_BATCH_WINDOW_MS = 500;
    public static final int DEFAULT_REQUEST_TIMEOUT_MS = 8_000;
    public static final String DEFAULT_BATCH_ENDPOINT_PATH = "/batch";

    private static final String DEFAULT_YAML = """
            # Generated default Arbiter config.
            # Review the bindings before routing production traffic through them.
            dispatch:
              exemptRoutes:
                - method: GET
                  prefixPath: /health
                - method: GET
                  exactPath: /status
              bindings:
                - id: ask
                  priority: 120
                  methods: [POST]
                  exactPaths: [/ask]
                  intentHints: [ask, chat]
                  sensitivity: non-sensitive
                  conflictPolicy: refresh_then_reroute
                  rerouteTarget: /ask
                  expectedRoute: POST /ask
                - id: api-family
                  priority: 50
                  methods: [GET, POST]
                  pathTemplates: ["/api/:resource", "/api/:resource/*"]
                  sensitivity: sensitive
                  conflictPolicy: strict_block
                  expectedRoute: /api
                - id: catch-all
                  priority: 1
                  methods: [GET, POST, PUT, PATCH, DELETE]
                  pathRegexes: ["^/.*$"]
                  sensitivity: non-sensitive
                  conflictPolicy: strict_block
                  expectedRoute: any
                  fallback: true

            admission:
              rateLimitPerMinute: %d
              cacheTtlMs: %d
              batchWindowMs: %d
              requestTimeoutMs: %d
              batchEndpointPath: %s
              singleFlight: false
            """;

    private ConfigDefaults() {
    }

    /**
     * Render the default configuration template.
     */
    public static String defaultYaml() {
        return DEFAULT_YAML.formatted(
                DEFAULT_RATE_LIMIT_PER_MINUTE,
                DEFAULT_CACHE_TTL_MS,
                DEFAULT_BATCH_WINDOW_MS,
                DEFAULT_REQUEST_TIMEOUT_MS,
                DEFAULT_BATCH_ENDPOINT_PATH
        );
    }
}
