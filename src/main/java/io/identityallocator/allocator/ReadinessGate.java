package io.identityallocator.allocator;

import io.identityallocator.context.OperationContext;
import io.identityallocator.exceptions.BackendException;
import io.identityallocator.exceptions.OperationCancelledException;

import java.util.concurrent.CompletableFuture;

/**
 * Resettable readiness signal. Waiters block until {@link #markReady()}; {@link #reset()}
 * re-arms the gate for the next lifecycle without affecting callers already released.
 */
public class ReadinessGate {

    private CompletableFuture<Void> ready = new CompletableFuture<>();

    public synchronized void markReady() {
        ready.complete(null);
    }

    public synchronized void reset() {
        if (ready.isDone()) {
            ready = new CompletableFuture<>();
        }
    }

    public synchronized boolean isReady() {
        return ready.isDone();
    }

    /**
     * Future completing when the gate opens. Completing or cancelling the returned copy
     * does not affect the gate.
     */
    public synchronized CompletableFuture<Void> whenReady() {
        return ready.copy();
    }

    /**
     * Block until the gate opens or {@code ctx} fires.
     */
    public void awaitReady(OperationContext ctx) throws OperationCancelledException {
        try {
            ctx.await(whenReady());
        } catch (BackendException e) {
            throw new IllegalStateException("readiness signal completed exceptionally", e);
        }
    }
}
