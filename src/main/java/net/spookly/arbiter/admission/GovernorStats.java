package net.spookly.arbiter.admission;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Point-in-time view of governor state for diagnostics.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class GovernorStats {
    private final int rateWindowSize;
    private final int cacheSize;
    private final int queuedBatchItems;
    private final boolean flushScheduled;
    private final int inFlightKeys;
}
