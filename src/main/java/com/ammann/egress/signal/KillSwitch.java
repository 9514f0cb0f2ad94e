/* (C)2026 */
package com.ammann.egress.signal;

import java.util.concurrent.CompletableFuture;

/**
 * One-shot broadcast signal.
 *
 * <p>Starts armed and moves to triggered exactly once. Any number of observers can
 * {@link #watch()} it; a watch taken after the trigger is already complete, so there is no
 * missed wakeup. Triggering again is a no-op.
 */
public final class KillSwitch {

    private final CompletableFuture<Void> triggered = new CompletableFuture<>();

    /**
     * Triggers the switch. Never blocks and never runs observer callbacks on the caller's
     * thread beyond what the observers attached themselves.
     *
     * @return true only for the call that performed the transition
     */
    public boolean trigger() {
        return triggered.complete(null);
    }

    /**
     * Returns a handle that completes once the switch has been triggered. Each caller gets its
     * own copy, so completing or cancelling a handle does not affect the switch or other
     * observers.
     */
    public CompletableFuture<Void> watch() {
        return triggered.copy();
    }

    public boolean isTriggered() {
        return triggered.isDone();
    }
}
