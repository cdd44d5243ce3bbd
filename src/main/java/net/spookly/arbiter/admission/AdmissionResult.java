package net.spookly.arbiter.admission;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Successful admission: the provider response and where it came from.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class AdmissionResult {
    private static final AdmissionResult PASS_THROUGH = new AdmissionResult(AdmissionOutcome.PASS_THROUGH, null, null);

    private final AdmissionOutcome outcome;
    private final String requestKey;
    /**
     * Provider response; null for pass-through.
     */
    private final JsonNode response;

    /**
     * Nothing to govern: the request carried no forward-able payload.
     */
    public static AdmissionResult passThrough() {
        return PASS_THROUGH;
    }

    public boolean isPassThrough() {
        return outcome == AdmissionOutcome.PASS_THROUGH;
    }
}
