package net.spookly.arbiter.admission;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Wraps an error raised by the provider on the direct or batched path.
 */
@Getter
@Accessors(fluent = true)
public class ProviderFailureException extends AdmissionException {
    private final boolean batched;

    public ProviderFailureException(String message, Throwable cause, boolean batched) {
        super(message, cause);
        this.batched = batched;
    }
}
