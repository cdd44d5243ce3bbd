package net.spookly.arbiter.admission;

import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.arbiter.config.ArbiterConfig;
import net.spookly.arbiter.config.ConfigDefaults;
import net.spookly.arbiter.util.RequestPaths;

/**
 * Numeric policy knobs of the admission governor, resolved once at construction.
 */
@Getter
@Accessors(fluent = true)
public final class AdmissionPolicy {
    private final int rateLimitPerMinute;
    private final long cacheTtlMs;
    private final long batchWindowMs;
    private final long requestTimeoutMs;
    private final String batchEndpointPath;
    /**
     * Join concurrent cache misses for the same key onto one provider call.
     */
    private final boolean singleFlight;

    public AdmissionPolicy(int rateLimitPerMinute,
                           long cacheTtlMs,
                           long batchWindowMs,
                           long requestTimeoutMs,
                           String batchEndpointPath,
                           boolean singleFlight) {
        this.rateLimitPerMinute = requirePositive(rateLimitPerMinute, "rateLimitPerMinute");
        this.cacheTtlMs = requirePositive(cacheTtlMs, "cacheTtlMs");
        this.batchWindowMs = requirePositive(batchWindowMs, "batchWindowMs");
        this.requestTimeoutMs = requirePositive(requestTimeoutMs, "requestTimeoutMs");
        this.batchEndpointPath = RequestPaths.normalizePath(
                batchEndpointPath == null ? ConfigDefaults.DEFAULT_BATCH_ENDPOINT_PATH : batchEndpointPath);
        this.singleFlight = singleFlight;
    }

    public static AdmissionPolicy defaults() {
        return new AdmissionPolicy(
                ConfigDefaults.DEFAULT_RATE_LIMIT_PER_MINUTE,
                ConfigDefaults.DEFAULT_CACHE_TTL_MS,
                ConfigDefaults.DEFAULT_BATCH_WINDOW_MS,
                ConfigDefaults.DEFAULT_REQUEST_TIMEOUT_MS,
                ConfigDefaults.DEFAULT_BATCH_ENDPOINT_PATH,
                false
        );
    }

    /**
     * Build a policy from the admission section, defaulting every absent knob.
     */
    public static AdmissionPolicy fromConfig(ArbiterConfig config) {
        ArbiterConfig.AdmissionConfig admission = config == null ? null : config.admission;
        if (admission == null) {
            return defaults();
        }
        return new AdmissionPolicy(
                orDefault(admission.rateLimitPerMinute, ConfigDefaults.DEFAULT_RATE_LIMIT_PER_MINUTE),
                orDefault(admission.cacheTtlMs, ConfigDefaults.DEFAULT_CACHE_TTL_MS),
                orDefault(admission.batchWindowMs, ConfigDefaults.DEFAULT_BATCH_WINDOW_MS),
                orDefault(admission.requestTimeoutMs, ConfigDefaults.DEFAULT_REQUEST_TIMEOUT_MS),
                admission.batchEndpointPath,
                admission.singleFlight != null && admission.singleFlight
        );
    }

    public AdmissionPolicy withRateLimitPerMinute(int value) {
        return new AdmissionPolicy(value, cacheTtlMs, batchWindowMs, requestTimeoutMs, batchEndpointPath, singleFlight);
    }

    public AdmissionPolicy withCacheTtlMs(long value) {
        return new AdmissionPolicy(rateLimitPerMinute, value, batchWindowMs, requestTimeoutMs, batchEndpointPath, singleFlight);
    }

    public AdmissionPolicy withBatchWindowMs(long value) {
        return new AdmissionPolicy(rateLimitPerMinute, cacheTtlMs, value, requestTimeoutMs, batchEndpointPath, singleFlight);
    }

    public AdmissionPolicy withRequestTimeoutMs(long value) {
        return new AdmissionPolicy(rateLimitPerMinute, cacheTtlMs, batchWindowMs, value, batchEndpointPath, singleFlight);
    }

    public AdmissionPolicy withBatchEndpointPath(String value) {
        return new AdmissionPolicy(rateLimitPerMinute, cacheTtlMs, batchWindowMs, requestTimeoutMs, value, singleFlight);
    }

    public AdmissionPolicy withSingleFlight(boolean value) {
        return new AdmissionPolicy(rateLimitPerMinute, cacheTtlMs, batchWindowMs, requestTimeoutMs, batchEndpointPath, value);
    }

    private static int orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }

    private static int requirePositive(int value, String field) {
        if (value <= 0) {
            throw new IllegalArgumentException(field + " must be greater than 0");
        }
        return value;
    }

    private static long requirePositive(long value, String field) {
        if (value <= 0) {
            throw new IllegalArgumentException(field + " must be greater than 0");
        }
        return value;
    }
}
