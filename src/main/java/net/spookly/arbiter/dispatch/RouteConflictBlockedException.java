package net.spookly.arbiter.dispatch;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Signals that a conflicted request was blocked by its governing binding.
 */
@Getter
@Accessors(fluent = true)
public class RouteConflictBlockedException extends RuntimeException {
    private final String governingBindingId;
    private final String expectedRoute;

    public RouteConflictBlockedException(String governingBindingId, String expectedRoute) {
        super("Route conflict blocked by binding " + governingBindingId
                + (expectedRoute == null ? "" : " (expected route: " + expectedRoute + ")"));
        this.governingBindingId = governingBindingId;
        this.expectedRoute = expectedRoute;
    }
}
