package net.spookly.arbiter.admission;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * The provider did not answer within the configured request timeout.
 */
@Getter
@Accessors(fluent = true)
public class AdmissionTimeoutException extends AdmissionException {
    private final long timeoutMs;

    public AdmissionTimeoutException(long timeoutMs) {
        super("Provider timeout after " + timeoutMs + "ms - fallback triggered");
        this.timeoutMs = timeoutMs;
    }
}
