package io.identityallocator.allocator;

import io.identityallocator.exceptions.AllocatorNotInitializedException;
import io.identityallocator.identity.Identity;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local reference counts of global identities, tied to one keep-alive task per
 * identity. The task exists exactly while the count is positive: it is armed before the
 * first reference is counted and removed, waiting for it to stop, before the last one is
 * dropped.
 */
@Slf4j
class IdentityRefCounter {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, Integer> counts = new HashMap<>();
    private final KeepAliveScheduler scheduler;
    private boolean closed;

    IdentityRefCounter(KeepAliveScheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Count one more reference on {@code identity}.
     *
     * @return the new count
     * @throws AllocatorNotInitializedException if the counter was cleared by a close()
     */
    int acquire(Identity identity) throws AllocatorNotInitializedException {
        long id = identity.getId();
        lock.lock();
        try {
            if (closed) {
                throw new AllocatorNotInitializedException();
            }
            int current = counts.getOrDefault(id, 0);
            if (current == 0) {
                scheduler.arm(identity);
            }
            counts.put(id, current + 1);
            return current + 1;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop one reference on {@code id}. Unknown ids are ignored.
     *
     * @return the remaining count
     */
    int release(long id) {
        lock.lock();
        try {
            int current = counts.getOrDefault(id, 0);
            if (current == 0) {
                log.debug("Ignoring release of untracked identity {}", id);
                return 0;
            }
            if (current == 1) {
                scheduler.disarm(id);
                counts.remove(id);
                return 0;
            }
            counts.put(id, current - 1);
            return current - 1;
        } finally {
            lock.unlock();
        }
    }

    int getCount(long id) {
        lock.lock();
        try {
            return counts.getOrDefault(id, 0);
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return counts.size();
        } finally {
            lock.unlock();
        }
    }

    long total() {
        lock.lock();
        try {
            return counts.values().stream().mapToLong(Integer::longValue).sum();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forget every reference and stop every task. Later acquires fail.
     */
    void clear() {
        lock.lock();
        try {
            closed = true;
            counts.clear();
            scheduler.disarmAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Starts and stops the keep-alive task of an identity. Called with the counter's lock
     * held; disarm calls return only once the task has stopped.
     */
    interface KeepAliveScheduler {

        void arm(Identity identity);

        void disarm(long id);

        void disarmAll();
    }
}
