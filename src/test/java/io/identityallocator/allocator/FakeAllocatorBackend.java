package io.identityallocator.allocator;

import io.etcd.jetcd.Client;
import io.identityallocator.backend.AllocatorBackendOptions;
import io.identityallocator.backend.AllocatorEvent;
import io.identityallocator.backend.BackendAllocation;
import io.identityallocator.backend.DistributedAllocatorBackend;
import io.identityallocator.backend.RemoteIdentityCache;
import io.identityallocator.context.OperationContext;
import io.identityallocator.exceptions.BackendException;
import io.identityallocator.exceptions.OperationCancelledException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory backend recording what the allocator asked of it.
 */
class FakeAllocatorBackend implements DistributedAllocatorBackend {

    final AllocatorBackendOptions options;
    final CompletableFuture<Void> synced = new CompletableFuture<>();
    final Set<String> failingReleases = new HashSet<>();
    final List<String> releasedKeys = new ArrayList<>();
    final List<String> reassertedKeys = new CopyOnWriteArrayList<>();
    final AtomicInteger reassertCancellations = new AtomicInteger();
    volatile BackendException reassertFailure;
    volatile boolean reassertHangs;
    volatile BackendException allocateFailure;
    volatile boolean closed;
    int allocateCalls;

    private final Map<String, Long> keyToId = new HashMap<>();
    private final Map<Long, String> idToKey = new HashMap<>();
    private final Map<String, Integer> holders = new HashMap<>();
    private long nextId;

    FakeAllocatorBackend(AllocatorBackendOptions options, boolean syncedAtStart) {
        this.options = options;
        this.nextId = options.getMinId();
        if (syncedAtStart) {
            synced.complete(null);
        }
    }

    @Override
    public synchronized BackendAllocation allocate(OperationContext ctx, String key)
            throws OperationCancelledException, BackendException {
        ctx.throwIfDone();
        allocateCalls++;
        if (allocateFailure != null) {
            throw allocateFailure;
        }
        boolean isNew = !keyToId.containsKey(key);
        long id = keyToId.computeIfAbsent(key, k -> (nextId++) | options.getPrefixMask());
        idToKey.put(id, key);
        holders.merge(key, 1, Integer::sum);
        if (isNew) {
            options.getEvents().offer(AllocatorEvent.upsert(id, key));
        }
        return new BackendAllocation(id, isNew);
    }

    @Override
    public BackendAllocation reassert(OperationContext ctx, String key)
            throws OperationCancelledException, BackendException {
        if (reassertHangs) {
            try {
                ctx.sleep(Duration.ofMinutes(1));
            } catch (OperationCancelledException e) {
                reassertCancellations.incrementAndGet();
                throw e;
            }
        }
        if (reassertFailure != null) {
            throw reassertFailure;
        }
        synchronized (this) {
            reassertedKeys.add(key);
            return new BackendAllocation(keyToId.get(key), false);
        }
    }

    @Override
    public synchronized boolean release(OperationContext ctx, String key) throws BackendException {
        if (failingReleases.contains(key)) {
            throw new BackendException("etcd unavailable releasing " + key);
        }
        releasedKeys.add(key);
        Integer count = holders.get(key);
        if (count == null) {
            return false;
        }
        if (count > 1) {
            holders.put(key, count - 1);
            return false;
        }
        holders.remove(key);
        return true;
    }

    @Override
    public void waitForInitialSync(OperationContext ctx) throws OperationCancelledException, BackendException {
        ctx.await(synced);
    }

    @Override
    public synchronized Optional<String> getById(long id) {
        return Optional.ofNullable(idToKey.get(id));
    }

    @Override
    public synchronized Optional<Long> getByKey(String key) {
        return Optional.ofNullable(keyToId.get(key));
    }

    @Override
    public RemoteIdentityCache watchRemoteBackend(Client remoteClient, String keyPrefix) {
        return new RemoteIdentityCache() {
            @Override
            public boolean isSynced() {
                return true;
            }

            @Override
            public int size() {
                return 0;
            }

            @Override
            public Optional<String> getById(long id) {
                return Optional.empty();
            }

            @Override
            public void close() {
            }
        };
    }

    @Override
    public void close() {
        closed = true;
    }
}
