package com.graphbench.telemetry.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of one metrics row: (framework, dataset, phase).
 * Ordered lexicographically by framework, then dataset, then phase.
 */
public record RunKey(String framework, String dataset, String phase) implements Comparable<RunKey> {

    private static final Comparator<RunKey> ORDER = Comparator
            .comparing(RunKey::framework)
            .thenComparing(RunKey::dataset)
            .thenComparing(RunKey::phase);

    public RunKey {
        Objects.requireNonNull(framework, "framework");
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(phase, "phase");
    }

    @Override
    public int compareTo(RunKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return framework + "/" + dataset + "/" + phase;
    }
}
