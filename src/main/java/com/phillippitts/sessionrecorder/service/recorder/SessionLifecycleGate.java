package com.phillippitts.sessionrecorder.service.recorder;

import java.util.concurrent.CompletableFuture;

/**
 * "The current session has fully settled" as a single-slot future.
 *
 * <p>{@link #begin()} opens the slot when a session starts; {@link #resolve()} completes it exactly
 * once when the session settles, whether it succeeded or failed. Waiters obtained through
 * {@link #await()} never observe an exceptional completion.
 */
final class SessionLifecycleGate {

    private CompletableFuture<Void> pending;

    /** Opens the slot; a second call while one is pending keeps the existing one. */
    synchronized void begin() {
        if (pending == null) {
            pending = new CompletableFuture<>();
        }
    }

    /** Completes and clears the slot. No-op when nothing is pending. */
    synchronized void resolve() {
        CompletableFuture<Void> current = pending;
        pending = null;
        if (current != null) {
            current.complete(null);
        }
    }

    /**
     * @return a future completing when the pending session settles, or an already completed
     *         future when nothing is pending
     */
    synchronized CompletableFuture<Void> await() {
        if (pending == null) {
            return CompletableFuture.completedFuture(null);
        }
        return pending.handle((v, ex) -> null);
    }

    synchronized boolean isPending() {
        return pending != null;
    }
}
