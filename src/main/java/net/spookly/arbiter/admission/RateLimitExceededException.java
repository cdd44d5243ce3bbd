package net.spookly.arbiter.admission;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Request rejected because the rate window is full (429-equivalent).
 */
@Getter
@Accessors(fluent = true)
public class RateLimitExceededException extends AdmissionException {
    private final int retryAfterSeconds;
    private final int effectiveLimit;

    public RateLimitExceededException(int retryAfterSeconds, int effectiveLimit) {
        super("Rate limit exceeded (" + effectiveLimit + " per minute), retry after " + retryAfterSeconds + "s");
        this.retryAfterSeconds = retryAfterSeconds;
        this.effectiveLimit = effectiveLimit;
    }
}
