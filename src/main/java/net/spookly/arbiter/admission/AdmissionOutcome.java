package net.spookly.arbiter.admission;

/**
 * How a successful admission was served.
 */
public enum AdmissionOutcome {
    PASS_THROUGH,
    CACHED,
    BATCHED,
    DIRECT
}
