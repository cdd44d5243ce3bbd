package net.spookly.arbiter.gateway;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.arbiter.admission.AdmissionResult;
import net.spookly.arbiter.dispatch.DispatchDecision;

@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class GatewayResult {
    private final DispatchDecision decision;
    /**
     * Null when the request was rerouted and admission never ran.
     */
    private final AdmissionResult admission;
}
