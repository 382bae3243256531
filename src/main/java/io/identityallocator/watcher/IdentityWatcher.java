package io.identityallocator.watcher;

import io.identityallocator.allocator.IdentityAllocatorOwner;
import io.identityallocator.backend.AllocatorEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;

/**
 * Consumes allocator events and turns each batch into a single policy update on the
 * owner. Must be started before any producer is attached to the queue.
 */
@Slf4j
public class IdentityWatcher {

    private static final String THREAD_NAME = "identity-watcher";

    private final Object lock = new Object();
    private Thread thread;

    /**
     * Start draining {@code events} into {@code owner}.
     *
     * @throws IllegalStateException if the watcher is already running
     */
    public void start(IdentityAllocatorOwner owner, BlockingQueue<AllocatorEvent> events) {
        synchronized (lock) {
            if (thread != null) {
                throw new IllegalStateException("identity watcher already running");
            }
            Thread t = new Thread(() -> consume(owner, events), THREAD_NAME);
            t.setDaemon(true);
            t.start();
            thread = t;
            log.info("Identity watcher started");
        }
    }

    private void consume(IdentityAllocatorOwner owner, BlockingQueue<AllocatorEvent> events) {
        List<AllocatorEvent> batch = new ArrayList<>();
        while (!Thread.currentThread().isInterrupted()) {
            try {
                batch.add(events.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            events.drainTo(batch);
            log.debug("Received {} identity events", batch.size());
            try {
                owner.triggerPolicyUpdates(false, batch.size() + " identity change(s)");
            } catch (RuntimeException e) {
                log.error("Policy update after identity changes failed: {}", e.getMessage(), e);
            }
            batch.clear();
        }
        log.debug("Identity watcher loop exited");
    }

    /**
     * Stop the consumer thread and wait for it to exit. Events still queued are discarded
     * together with the queue by the caller.
     */
    public void stop() {
        Thread t;
        synchronized (lock) {
            t = thread;
            thread = null;
        }
        if (t == null) {
            return;
        }
        t.interrupt();
        try {
            t.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping identity watcher");
        }
        log.info("Identity watcher stopped");
    }

    public boolean isRunning() {
        synchronized (lock) {
            return thread != null && thread.isAlive();
        }
    }
}
