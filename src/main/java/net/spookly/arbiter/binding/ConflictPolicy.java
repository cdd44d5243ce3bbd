package net.spookly.arbiter.binding;

import java.util.Objects;

/**
 * What a governing binding does when more than one binding matches a request.
 * <p>
 * Only two variants exist: {@link StrictBlock}, which carries nothing, and {@link RerouteTo}, which
 * carries the optional reroute target.
 */
public abstract class ConflictPolicy {
    public static final String STRICT_BLOCK = "strict_block";
    public static final String REFRESH_THEN_REROUTE = "refresh_then_reroute";

    private ConflictPolicy() {
    }

    public static ConflictPolicy strictBlock() {
        return StrictBlock.INSTANCE;
    }

    /**
     * Reroute on conflict; a null target means the governing binding's own path.
     */
    public static ConflictPolicy rerouteTo(String target) {
        return new RerouteTo(target);
    }

    /**
     * Map the configured policy name; unknown names fall back to strict blocking.
     */
    public static ConflictPolicy fromConfig(String value, String rerouteTarget) {
        if (value != null && REFRESH_THEN_REROUTE.equalsIgnoreCase(value.trim())) {
            return rerouteTo(rerouteTarget);
        }
        if (rerouteTarget != null && !rerouteTarget.isBlank()) {
            throw new IllegalArgumentException("strict_block policy cannot carry a reroute target");
        }
        return strictBlock();
    }

    public abstract String configValue();

    public static final class StrictBlock extends ConflictPolicy {
        private static final StrictBlock INSTANCE = new StrictBlock();

        private StrictBlock() {
        }

        @Override
        public String configValue() {
            return STRICT_BLOCK;
        }

        @Override
        public String toString() {
            return STRICT_BLOCK;
        }
    }

    public static final class RerouteTo extends ConflictPolicy {
        private final String target;

        private RerouteTo(String target) {
            this.target = target == null || target.isBlank() ? null : target.trim();
        }

        /**
         * Configured target, or null when the binding reroutes to its own path.
         */
        public String target() {
            return target;
        }

        @Override
        public String configValue() {
            return REFRESH_THEN_REROUTE;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof RerouteTo)) {
                return false;
            }
            return Objects.equals(target, ((RerouteTo) other).target);
        }

        @Override
        public int hashCode() {
            return Objects.hash(REFRESH_THEN_REROUTE, target);
        }

        @Override
        public String toString() {
            return target == null ? REFRESH_THEN_REROUTE : REFRESH_THEN_REROUTE + "(" + target + ")";
        }
    }
}
