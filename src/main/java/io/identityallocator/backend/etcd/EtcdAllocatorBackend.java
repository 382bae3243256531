package io.identityallocator.backend.etcd;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Lease;
import io.etcd.jetcd.Lock;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.lease.LeaseKeepAliveResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import io.etcd.jetcd.support.CloseableClient;
import io.grpc.stub.StreamObserver;
import io.identityallocator.backend.AllocatorBackendOptions;
import io.identityallocator.backend.BackendAllocation;
import io.identityallocator.backend.DistributedAllocatorBackend;
import io.identityallocator.backend.RemoteIdentityCache;
import io.identityallocator.context.OperationContext;
import io.identityallocator.exceptions.BackendException;
import io.identityallocator.exceptions.OperationCancelledException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Distributed allocator storing identities in etcd.
 *
 * Each id is owned by a master key holding the canonical label key. Every node using a
 * key additionally writes a per-node key bound to its lease, so a crashed node's claims
 * disappear with its lease. Allocation of a key is serialized cluster-wide through an
 * etcd lock on the key, and master keys are created with a create-only transaction.
 */
@Slf4j
public class EtcdAllocatorBackend implements DistributedAllocatorBackend {

    private static final int ETCD_OPERATION_TIMEOUT_SECONDS = 5;
    private static final int MAX_ALLOCATION_ATTEMPTS = 16;

    private final AllocatorBackendOptions options;
    private final EtcdKeyLayout layout;
    private final KV kvClient;
    private final Lease leaseClient;
    private final Lock lockClient;
    private final long leaseId;
    private final CloseableClient keepAlive;
    private final EtcdIdentityMirror mirror;

    // Serializes allocation and release on this node; guards localKeys
    private final ReentrantLock allocationLock = new ReentrantLock();
    private final Map<String, Integer> localKeys = new HashMap<>();
    private final List<RemoteIdentityCache> remoteCaches = new ArrayList<>();

    public EtcdAllocatorBackend(Client etcdClient, AllocatorBackendOptions options) throws BackendException {
        this.options = options;
        this.layout = new EtcdKeyLayout(options.getBasePath());
        this.kvClient = etcdClient.getKVClient();
        this.leaseClient = etcdClient.getLeaseClient();
        this.lockClient = etcdClient.getLockClient();

        try {
            this.leaseId = leaseClient.grant(options.getLeaseTtlSeconds())
                .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .getID();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException("Interrupted while granting allocator lease", e);
        } catch (Exception e) {
            log.error("Failed to grant allocator lease: {}", e.getMessage(), e);
            throw new BackendException("Failed to grant allocator lease", e);
        }
        this.keepAlive = leaseClient.keepAlive(leaseId, new LeaseKeepAliveObserver());

        this.mirror = new EtcdIdentityMirror("local", layout, kvClient, etcdClient.getWatchClient(), options.getEvents());
        mirror.start();

        log.info("etcd allocator started below {} (lease {}, suffix {}, range [{}, {}], prefix mask {})",
            layout.getBasePath(), leaseId, options.getSuffix(), options.getMinId(), options.getMaxId(),
            options.getPrefixMask());
    }

    // =================================================================
    // ALLOCATION
    // =================================================================

    @Override
    public BackendAllocation allocate(OperationContext ctx, String key)
            throws OperationCancelledException, BackendException {
        lockInterruptibly(ctx);
        try {
            Integer refs = localKeys.get(key);
            Optional<Long> cached = mirror.getByKey(key);
            if (refs != null && cached.isPresent()) {
                localKeys.put(key, refs + 1);
                return new BackendAllocation(cached.get(), false);
            }
            BackendAllocation allocation = allocateInEtcd(ctx, key);
            localKeys.merge(key, 1, Integer::sum);
            return allocation;
        } finally {
            allocationLock.unlock();
        }
    }

    @Override
    public BackendAllocation reassert(OperationContext ctx, String key)
            throws OperationCancelledException, BackendException {
        lockInterruptibly(ctx);
        try {
            return allocateInEtcd(ctx, key);
        } finally {
            allocationLock.unlock();
        }
    }

    private BackendAllocation allocateInEtcd(OperationContext ctx, String key)
            throws OperationCancelledException, BackendException {
        ByteSequence lockKey = acquireKeyLock(ctx, key);
        try {
            Long existing = findExistingId(ctx, key);
            if (existing == null) {
                // no node holds the key right now, but its master key may still exist
                existing = mirror.getByKey(key).orElse(null);
            }
            long id;
            boolean isNew = false;
            if (existing != null) {
                id = existing;
                if (options.isMasterKeyProtection()) {
                    ensureMasterKey(ctx, id, key);
                }
            } else {
                id = createMasterKey(ctx, key);
                isNew = true;
            }
            writeNodeKey(ctx, key, id);
            mirror.remember(id, key);
            if (isNew) {
                log.info("Allocated new identity {} for {}", id, key);
            }
            return new BackendAllocation(id, isNew);
        } finally {
            releaseKeyLock(lockKey);
        }
    }

    private ByteSequence acquireKeyLock(OperationContext ctx, String key)
            throws OperationCancelledException, BackendException {
        ByteSequence name = ByteSequence.from(layout.getLockPath(key), UTF_8);
        return ctx.await(withTimeout(lockClient.lock(name, leaseId))).getKey();
    }

    private void releaseKeyLock(ByteSequence lockKey) {
        try {
            lockClient.unlock(lockKey).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while releasing allocation lock {}", lockKey.toString(UTF_8));
        } catch (Exception e) {
            // the lock is bound to the node lease and goes away with it
            log.error("Error releasing allocation lock {}: {}", lockKey.toString(UTF_8), e.getMessage());
        }
    }

    /**
     * Id some node already uses for {@code key}, read from any per-node key.
     */
    private Long findExistingId(OperationContext ctx, String key)
            throws OperationCancelledException, BackendException {
        ByteSequence prefix = ByteSequence.from(layout.getValuePrefix(key), UTF_8);
        GetResponse response = ctx.await(withTimeout(kvClient.get(prefix,
            GetOption.newBuilder().withPrefix(prefix).withLimit(1).build())));
        if (response.getKvs().isEmpty()) {
            return null;
        }
        KeyValue kv = response.getKvs().get(0);
        String value = kv.getValue().toString(UTF_8);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new BackendException("Corrupt identity value '" + value + "' at " + kv.getKey().toString(UTF_8), e);
        }
    }

    private long createMasterKey(OperationContext ctx, String key)
            throws OperationCancelledException, BackendException {
        Set<Long> attempted = new HashSet<>();
        for (int attempt = 0; attempt < MAX_ALLOCATION_ATTEMPTS; attempt++) {
            long id = selectFreeId(attempted);
            if (id < 0) {
                break;
            }
            attempted.add(id);
            if (createIfAbsent(ctx, layout.getIdPath(id), key)) {
                return id;
            }
            log.debug("Identity {} was taken concurrently, retrying", id);
        }
        throw new BackendException("no more available IDs in configured space for " + key);
    }

    private long selectFreeId(Set<Long> attempted) {
        for (long candidate = options.getMinId(); candidate <= options.getMaxId(); candidate++) {
            long id = candidate | options.getPrefixMask();
            if (!attempted.contains(id) && !mirror.containsId(id)) {
                return id;
            }
        }
        return -1;
    }

    private void ensureMasterKey(OperationContext ctx, long id, String key)
            throws OperationCancelledException, BackendException {
        if (createIfAbsent(ctx, layout.getIdPath(id), key)) {
            log.warn("Recreated missing master key for identity {} ({})", id, key);
        }
    }

    private boolean createIfAbsent(OperationContext ctx, String path, String value)
            throws OperationCancelledException, BackendException {
        ByteSequence keyBytes = ByteSequence.from(path, UTF_8);
        TxnResponse txnResponse = ctx.await(withTimeout(kvClient.txn()
            .If(new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.version(0)))
            .Then(Op.put(keyBytes, ByteSequence.from(value, UTF_8), PutOption.DEFAULT))
            .commit()));
        return txnResponse.isSucceeded();
    }

    private void writeNodeKey(OperationContext ctx, String key, long id)
            throws OperationCancelledException, BackendException {
        ByteSequence path = ByteSequence.from(layout.getValuePath(key, options.getSuffix()), UTF_8);
        ctx.await(withTimeout(kvClient.put(path, ByteSequence.from(Long.toString(id), UTF_8),
            PutOption.newBuilder().withLeaseId(leaseId).build())));
    }

    // =================================================================
    // RELEASE
    // =================================================================

    @Override
    public boolean release(OperationContext ctx, String key)
            throws OperationCancelledException, BackendException {
        lockInterruptibly(ctx);
        try {
            Integer refs = localKeys.get(key);
            if (refs == null) {
                log.warn("Release of {} which this node does not hold", key);
                return false;
            }
            if (refs > 1) {
                localKeys.put(key, refs - 1);
                return false;
            }

            ByteSequence path = ByteSequence.from(layout.getValuePath(key, options.getSuffix()), UTF_8);
            ctx.await(withTimeout(kvClient.delete(path)));
            localKeys.remove(key);

            ByteSequence prefix = ByteSequence.from(layout.getValuePrefix(key), UTF_8);
            GetResponse remaining = ctx.await(withTimeout(kvClient.get(prefix,
                GetOption.newBuilder().withPrefix(prefix).withCountOnly(true).build())));
            boolean lastUse = remaining.getCount() == 0;
            log.debug("Released {} on this node (last use in cluster: {})", key, lastUse);
            return lastUse;
        } finally {
            allocationLock.unlock();
        }
    }

    // =================================================================
    // VIEWS
    // =================================================================

    @Override
    public void waitForInitialSync(OperationContext ctx) throws OperationCancelledException, BackendException {
        ctx.await(mirror.syncFuture());
    }

    @Override
    public Optional<String> getById(long id) {
        return mirror.getById(id);
    }

    @Override
    public Optional<Long> getByKey(String key) {
        return mirror.getByKey(key);
    }

    @Override
    public RemoteIdentityCache watchRemoteBackend(Client remoteClient, String keyPrefix) {
        EtcdIdentityMirror remote = new EtcdIdentityMirror("remote " + keyPrefix, new EtcdKeyLayout(keyPrefix),
            remoteClient.getKVClient(), remoteClient.getWatchClient(), options.getEvents());
        remote.start();
        EtcdRemoteIdentityCache cache = new EtcdRemoteIdentityCache(remote);
        synchronized (remoteCaches) {
            remoteCaches.add(cache);
        }
        log.info("Watching remote identities below {}", keyPrefix);
        return cache;
    }

    /**
     * Stop following identity changes and revoke the node lease, which removes every
     * per-node key and lock this node holds.
     */
    @Override
    public void close() {
        synchronized (remoteCaches) {
            remoteCaches.forEach(RemoteIdentityCache::close);
            remoteCaches.clear();
        }
        mirror.close();
        keepAlive.close();
        try {
            leaseClient.revoke(leaseId).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.info("etcd allocator below {} closed, lease {} revoked", layout.getBasePath(), leaseId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while revoking lease {}", leaseId);
        } catch (Exception e) {
            log.error("Error revoking lease {}: {}", leaseId, e.getMessage());
        }
        allocationLock.lock();
        try {
            localKeys.clear();
        } finally {
            allocationLock.unlock();
        }
    }

    long getLeaseId() {
        return leaseId;
    }

    private void lockInterruptibly(OperationContext ctx) throws OperationCancelledException {
        try {
            allocationLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("interrupted while waiting for allocation lock", e);
        }
        if (ctx.isDone()) {
            allocationLock.unlock();
            ctx.throwIfDone();
        }
    }

    private static <T> CompletableFuture<T> withTimeout(CompletableFuture<T> future) {
        return future.orTimeout(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private class LeaseKeepAliveObserver implements StreamObserver<LeaseKeepAliveResponse> {
        @Override
        public void onNext(LeaseKeepAliveResponse response) {
            log.trace("Lease {} refreshed, ttl {}", leaseId, response.getTTL());
        }

        @Override
        public void onError(Throwable t) {
            log.warn("Keep-alive of lease {} failed: {}", leaseId, t.getMessage());
        }

        @Override
        public void onCompleted() {
            log.debug("Keep-alive of lease {} completed", leaseId);
        }
    }
}
