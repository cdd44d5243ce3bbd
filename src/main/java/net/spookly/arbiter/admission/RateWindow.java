package net.spookly.arbiter.admission;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding 60 second window of accepted request timestamps for one governor.
 * <p>
 * Not thread-safe: confined to the governor's executor so that trim, check and append run
 * without interleaving.
 */
final class RateWindow {
    static final long WINDOW_MILLIS = 60_000L;

    private final Deque<Long> timestamps = new ArrayDeque<>();

    /**
     * Trim expired entries, then record {@code now} if fewer than {@code limit} remain.
     *
     * @return false when the window is full; nothing is recorded in that case.
     */
    boolean tryAcquire(int limit, long now) {
        trim(now);
        if (timestamps.size() >= limit) {
            return false;
        }
        timestamps.addLast(now);
        return true;
    }

    int size(long now) {
        trim(now);
        return timestamps.size();
    }

    private void trim(long now) {
        long cutoff = now - WINDOW_MILLIS;
        while (!timestamps.isEmpty() && timestamps.peekFirst() < cutoff) {
            timestamps.removeFirst();
        }
    }
}
