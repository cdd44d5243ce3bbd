package net.spookly.arbiter.admission;

import java.time.Clock;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Idle state derived from observed traffic.
 * <p>
 * Keeps an exponentially weighted request rate and an adaptive idle timeout: busy traffic stretches the
 * timeout, sparse traffic shrinks it. The process is idle once no request has been seen for longer than
 * the current timeout, unless memory is under pressure: heap usage grew by more than 10% over the last
 * growth window, or the process footprint exceeds the memory threshold. {@link #markCritical(boolean)}
 * overrides everything.
 */
public final class TrafficIdleStateProvider implements IdleStateProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(TrafficIdleStateProvider.class);

    static final long INITIAL_IDLE_TIMEOUT_MS = 30_000L;
    static final long MIN_IDLE_TIMEOUT_MS = 10_000L;
    static final long MAX_IDLE_TIMEOUT_MS = 120_000L;
    static final double EWMA_DECAY = 0.85;
    static final double BUSY_RATE_PER_SECOND = 0.5;
    static final double QUIET_RATE_PER_SECOND = 0.05;
    static final long MEMORY_GROWTH_WINDOW_MS = 60_000L;
    static final double MEMORY_GROWTH_FACTOR = 1.1;
    static final long DEFAULT_MEMORY_THRESHOLD_BYTES = 150L * 1024 * 1024;

    private final Clock clock;
    private final MemorySampler memory;
    private final long memoryThresholdBytes;
    private long lastRequestMillis;
    private double trafficRate;
    private long idleTimeoutMs = INITIAL_IDLE_TIMEOUT_MS;
    private long lastHeapUsed;
    private long lastMemoryCheckMillis;
    private boolean memoryGrowing;
    private volatile boolean critical;

    public TrafficIdleStateProvider(Clock clock) {
        this(clock, MemorySampler.JVM, DEFAULT_MEMORY_THRESHOLD_BYTES);
    }

    public TrafficIdleStateProvider(Clock clock, MemorySampler memory, long memoryThresholdBytes) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.memory = memory == null ? MemorySampler.JVM : memory;
        this.memoryThresholdBytes = memoryThresholdBytes;
        this.lastRequestMillis = this.clock.millis();
        this.lastMemoryCheckMillis = this.lastRequestMillis;
        this.lastHeapUsed = this.memory.heapUsedBytes();
    }

    @Override
    public synchronized IdleState getState() {
        if (critical) {
            return IdleState.CRITICAL;
        }
        long now = clock.millis();
        long heapUsed = memory.heapUsedBytes();
        if (now - lastMemoryCheckMillis > MEMORY_GROWTH_WINDOW_MS) {
            memoryGrowing = heapUsed > lastHeapUsed * MEMORY_GROWTH_FACTOR;
            lastHeapUsed = heapUsed;
            lastMemoryCheckMillis = now;
        }
        boolean overThreshold = memory.footprintBytes() > memoryThresholdBytes;
        boolean idle = !memoryGrowing && !overThreshold && now - lastRequestMillis > idleTimeoutMs;
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Idle check: idle={} memoryGrowing={} overThreshold={} idleTimeout={}ms",
                    idle, memoryGrowing, overThreshold, idleTimeoutMs);
        }
        return idle ? IdleState.IDLE : IdleState.ACTIVE;
    }

    @Override
    public synchronized void noteTraffic(Map<String, Object> meta) {
        long now = clock.millis();
        double elapsedSeconds = (now - lastRequestMillis) / 1000.0;
        lastRequestMillis = now;

        double instantRate = elapsedSeconds > 0 ? 1 / elapsedSeconds : 0;
        trafficRate = EWMA_DECAY * trafficRate + (1 - EWMA_DECAY) * instantRate;

        if (trafficRate > BUSY_RATE_PER_SECOND) {
            idleTimeoutMs = Math.min(MAX_IDLE_TIMEOUT_MS, Math.round(idleTimeoutMs * 1.5));
        } else if (trafficRate < QUIET_RATE_PER_SECOND) {
            idleTimeoutMs = Math.max(MIN_IDLE_TIMEOUT_MS, Math.round(idleTimeoutMs * 0.8));
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Traffic noted {} (rate {}/s, idle timeout {}ms)",
                    meta, String.format("%.3f", trafficRate), idleTimeoutMs);
        }
    }

    /**
     * Force {@link IdleState#CRITICAL} until cleared.
     */
    public void markCritical(boolean critical) {
        if (this.critical != critical) {
            LOGGER.info("Critical load flag {}", critical ? "raised" : "cleared");
        }
        this.critical = critical;
    }

    public synchronized double trafficRate() {
        return trafficRate;
    }

    public synchronized long idleTimeoutMs() {
        return idleTimeoutMs;
    }

    public synchronized boolean memoryGrowing() {
        return memoryGrowing;
    }
}
