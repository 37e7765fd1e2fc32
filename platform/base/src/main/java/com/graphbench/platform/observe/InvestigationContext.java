package com.graphbench.platform.observe;

import java.util.function.Supplier;

/**
 * Thread-local switch for investigation (debug) mode.
 *
 * The CLI enables it for {@code --debug}; aggregation workers inherit it via
 * {@link #withInvestigation(boolean, Supplier)}.
 */
public final class InvestigationContext {

    private static final ThreadLocal<Boolean> ACTIVE = ThreadLocal.withInitial(() -> false);

    private InvestigationContext() {}

    public static void enable() {
        ACTIVE.set(true);
    }

    public static void disable() {
        ACTIVE.remove();
    }

    public static boolean isActive() {
        return ACTIVE.get();
    }

    /**
     * Run work with investigation mode set to {@code active}, then restore the previous state.
     */
    public static <T> T withInvestigation(boolean active, Supplier<T> work) {
        boolean wasActive = isActive();
        ACTIVE.set(active);
        try {
            return work.get();
        } finally {
            if (wasActive) {
                enable();
            } else {
                disable();
            }
        }
    }
}
