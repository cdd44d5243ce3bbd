package net.spookly.arbiter.dispatch;

/**
 * Outcome of dispatching a request against the binding registry.
 */
public enum DispatchAction {
    ALLOW("allow"),
    BLOCK("block"),
    REROUTE("reroute");

    private final String label;

    DispatchAction(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
