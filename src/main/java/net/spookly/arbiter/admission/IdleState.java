package net.spookly.arbiter.admission;

/**
 * External load signal that scales the admission rate limit.
 */
public enum IdleState {
    ACTIVE("active"),
    IDLE("idle"),
    CRITICAL("critical");

    private final String label;

    IdleState(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Limit in effect for this state: the base rate when active, half of it (at least 1) when idle,
     * and 1 when critical.
     */
    public int effectiveLimit(int baseRatePerMinute) {
        switch (this) {
            case IDLE:
                return Math.max(1, baseRatePerMinute / 2);
            case CRITICAL:
                return 1;
            case ACTIVE:
            default:
                return baseRatePerMinute;
        }
    }

    @Override
    public String toString() {
        return label;
    }
}
