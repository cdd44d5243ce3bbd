package net.spookly.arbiter.dispatch;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Per-request dispatch result. Never persisted.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class DispatchDecision {
    private final DispatchAction action;
    /**
     * Governing binding id, null for exempt routes.
     */
    private final String matchedBindingId;
    private final boolean conflicted;
    private final String rerouteTarget;
    /**
     * Ids of every binding that matched, in evaluation order.
     */
    private final List<String> candidateIds;
    private final String expectedRoute;
    private final String bindingsVersion;
    private final String reason;

    static DispatchDecision exempt(String bindingsVersion) {
        return new DispatchDecision(DispatchAction.ALLOW, null, false, null, List.of(), null, bindingsVersion, "exempt");
    }

    public boolean isAllowed() {
        return action == DispatchAction.ALLOW;
    }

    public boolean isBlocked() {
        return action == DispatchAction.BLOCK;
    }

    public boolean isRerouted() {
        return action == DispatchAction.REROUTE;
    }

    /**
     * Throw {@link RouteConflictBlockedException} when this decision blocks the request.
     */
    public DispatchDecision requireNotBlocked() {
        if (isBlocked()) {
            throw new RouteConflictBlockedException(matchedBindingId, expectedRoute);
        }
        return this;
    }

    @Override
    public String toString() {
        return "DispatchDecision{" + action + ", binding=" + matchedBindingId + ", conflicted=" + conflicted
                + (rerouteTarget == null ? "" : ", rerouteTarget=" + rerouteTarget) + ", reason=" + reason + "}";
    }
}
