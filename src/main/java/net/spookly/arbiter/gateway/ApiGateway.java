package net.spookly.arbiter.gateway;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import net.spookly.arbiter.admission.AdmissionGovernor;
import net.spookly.arbiter.admission.AdmissionResult;
import net.spookly.arbiter.dispatch.DispatchDecision;
import net.spookly.arbiter.dispatch.DispatchRequest;
import net.spookly.arbiter.dispatch.PatternDispatcher;
import net.spookly.arbiter.dispatch.RouteConflictBlockedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs dispatch and then admission for one request.
 * <p>
 * Blocked requests fail with {@link RouteConflictBlockedException}. Rerouted requests complete with the
 * advisory decision and are not admitted; the caller forwards them to the reroute target. Allowed requests
 * without a request key pass through.
 */
public final class ApiGateway {
    private static final Logger LOGGER = LoggerFactory.getLogger(ApiGateway.class);

    private final PatternDispatcher dispatcher;
    private final AdmissionGovernor governor;

    public ApiGateway(PatternDispatcher dispatcher, AdmissionGovernor governor) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.governor = Objects.requireNonNull(governor, "governor");
    }

    public CompletableFuture<GatewayResult> handle(InboundRequest request) {
        DispatchDecision decision = dispatcher.dispatch(
                new DispatchRequest(request.method(), request.path(), request.intentHints()));
        if (decision.isBlocked()) {
            LOGGER.info("Blocked {} {} ({})", request.method(), request.path(), decision.reason());
            return CompletableFuture.failedFuture(
                    new RouteConflictBlockedException(decision.matchedBindingId(), decision.expectedRoute()));
        }
        if (decision.isRerouted()) {
            return CompletableFuture.completedFuture(new GatewayResult(decision, null));
        }
        if (request.requestKey() == null || request.requestKey().isEmpty()) {
            return CompletableFuture.completedFuture(new GatewayResult(decision, AdmissionResult.passThrough()));
        }
        return governor.admit(request.requestKey(), request.payload(), request.path())
                .thenApply(admission -> new GatewayResult(decision, admission));
    }
}
