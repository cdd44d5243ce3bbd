package net.spookly.arbiter.admission;

import java.util.Map;

/**
 * Source of the current {@link IdleState}; read by the governor, never owned by it.
 */
@FunctionalInterface
public interface IdleStateProvider {
    IdleStateProvider ALWAYS_ACTIVE = () -> IdleState.ACTIVE;

    IdleState getState();

    /**
     * Observe one governed request. Optional.
     */
    default void noteTraffic(Map<String, Object> meta) {
    }
}
