package net.spookly.arbiter.admission;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;

/**
 * Source of process memory readings for the idle check.
 */
public interface MemorySampler {
    /**
     * Reads the running JVM through its {@link MemoryMXBean}.
     */
    MemorySampler JVM = new MemorySampler() {
        private final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();

        @Override
        public long heapUsedBytes() {
            return memory.getHeapMemoryUsage().getUsed();
        }

        @Override
        public long footprintBytes() {
            return memory.getHeapMemoryUsage().getCommitted() + memory.getNonHeapMemoryUsage().getCommitted();
        }
    };

    long heapUsedBytes();

    /**
     * Memory committed by the process (heap plus non-heap).
     */
    long footprintBytes();
}
