package com.graphbench.telemetry.sampler;

/**
 * Source of host-wide resource counters.
 *
 * Implementations never throw for an unreadable source: the affected fields read as zero.
 * CPU percent is the busy share since the previous call, so the first call only primes it.
 */
public interface HostCounters {

    CounterSnapshot read();

    /**
     * Counters of the machine this JVM runs on.
     */
    static HostCounters system() {
        return ProcfsHostCounters.create();
    }
}
