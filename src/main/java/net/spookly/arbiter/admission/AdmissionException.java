package net.spookly.arbiter.admission;

/**
 * Terminal admission failure delivered through the caller's future.
 */
public abstract class AdmissionException extends RuntimeException {
    protected AdmissionException(String message) {
        super(message);
    }

    protected AdmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
