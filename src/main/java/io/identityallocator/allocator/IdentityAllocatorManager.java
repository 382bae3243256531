package io.identityallocator.allocator;

import com.google.common.util.concurrent.AtomicDouble;
import io.etcd.jetcd.Client;
import io.identityallocator.backend.AllocatorBackendFactory;
import io.identityallocator.backend.AllocatorBackendOptions;
import io.identityallocator.backend.AllocatorEvent;
import io.identityallocator.backend.BackendAllocation;
import io.identityallocator.backend.DistributedAllocatorBackend;
import io.identityallocator.backend.RemoteIdentityCache;
import io.identityallocator.cache.InMemoryLocalIdentityCache;
import io.identityallocator.cache.LocalIdentityCache;
import io.identityallocator.config.IdentityAllocatorConfig;
import io.identityallocator.context.OperationContext;
import io.identityallocator.exceptions.AllocatorNotInitializedException;
import io.identityallocator.exceptions.BackendException;
import io.identityallocator.exceptions.IdentityAllocationException;
import io.identityallocator.exceptions.InvalidAllocatorStateException;
import io.identityallocator.exceptions.OperationCancelledException;
import io.identityallocator.identity.AllocationResult;
import io.identityallocator.identity.Identity;
import io.identityallocator.identity.IdentityScope;
import io.identityallocator.identity.ReservedIdentities;
import io.identityallocator.labels.Labels;
import io.identityallocator.metrics.MetricsProvider;
import io.identityallocator.tasks.BackgroundTaskManager;
import io.identityallocator.tasks.TaskStatus;
import io.identityallocator.watcher.IdentityWatcher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static io.identityallocator.config.Constants.*;

/**
 * Resolves label sets to numeric identities.
 *
 * Reserved and well-known label sets resolve from a fixed table. Label sets that only
 * have meaning on this node go to the local identity cache. Everything else is allocated
 * through the distributed backend once its initial sync completed; those allocations are
 * reference counted in this process and kept alive by one background task per identity
 * for as long as a reference is held.
 *
 * The allocator is live between {@link #init(IdentityAllocatorOwner)} and
 * {@link #close()}, and may be initialized again after a close.
 */
@Slf4j
public class IdentityAllocatorManager {

    private static final String TASK_MANAGER_NAME = "identity-keepalive";
    // The keep-alive body sleeps for the refresh interval itself
    private static final Duration KEEPALIVE_RUN_INTERVAL = Duration.ofMillis(1);

    private final IdentityAllocatorConfig config;
    private final AllocatorBackendFactory backendFactory;
    private final ReservedIdentities reservedIdentities;
    private final IdentityWatcher watcher;
    private final ReadinessGate readiness = new ReadinessGate();
    private final ReentrantLock lifecycleLock = new ReentrantLock();

    private volatile AllocatorState state;

    private final MetricsProvider metricsProvider;
    private final Counter releases;
    private final Counter releaseFailures;
    private final AtomicDouble globalReferences;
    private final Timer allocateLatency;

    public IdentityAllocatorManager(IdentityAllocatorConfig config,
                                    AllocatorBackendFactory backendFactory,
                                    ReservedIdentities reservedIdentities,
                                    MetricsProvider metricsProvider) {
        this(config, backendFactory, reservedIdentities, metricsProvider, new IdentityWatcher());
    }

    IdentityAllocatorManager(IdentityAllocatorConfig config,
                             AllocatorBackendFactory backendFactory,
                             ReservedIdentities reservedIdentities,
                             MetricsProvider metricsProvider,
                             IdentityWatcher watcher) {
        this.config = config;
        this.backendFactory = backendFactory;
        this.reservedIdentities = reservedIdentities;
        this.watcher = watcher;

        this.metricsProvider = metricsProvider;
        this.releases = metricsProvider.counter(METRIC_RELEASES, Map.of());
        this.releaseFailures = metricsProvider.counter(METRIC_RELEASE_FAILURES, Map.of());
        this.globalReferences = metricsProvider.gauge(METRIC_GLOBAL_REFERENCES, 0, Map.of());
        this.allocateLatency = metricsProvider.timer(METRIC_ALLOCATE_LATENCY, Map.of());
    }

    // =================================================================
    // LIFECYCLE
    // =================================================================

    /**
     * Bring the allocator up for {@code owner}.
     *
     * @throws InvalidAllocatorStateException if the allocator is already initialized
     * @throws BackendException if the distributed backend could not be created
     */
    public void init(IdentityAllocatorOwner owner) throws BackendException {
        lifecycleLock.lock();
        try {
            if (state != null) {
                throw new InvalidAllocatorStateException("identity allocator already initialized");
            }
            log.info("Initializing identity allocator for node {} (cluster {})", owner.getNodeSuffix(), config.getClusterName());

            reservedIdentities.initWellKnownIdentities(config.getClusterName());

            // Phase 1: event delivery. Phase 2 (backend creation) starts populating the queue.
            BlockingQueue<AllocatorEvent> events = new ArrayBlockingQueue<>(EVENT_QUEUE_CAPACITY);
            watcher.start(owner, events);
            if (!watcher.isRunning()) {
                throw new InvalidAllocatorStateException("identity watcher must be running before the backend is created");
            }

            DistributedAllocatorBackend backend;
            try {
                backend = backendFactory.create(AllocatorBackendOptions.builder()
                    .basePath(config.getBasePath())
                    .minId(config.getMinId())
                    .maxId(config.getMaxId())
                    .prefixMask(config.getPrefixMask())
                    .suffix(owner.getNodeSuffix())
                    .events(events)
                    .masterKeyProtection(true)
                    .leaseTtlSeconds(config.getLeaseTtlSeconds())
                    .build());
            } catch (BackendException | RuntimeException e) {
                log.error("Failed to create identity allocator backend: {}", e.getMessage(), e);
                watcher.stop();
                throw e;
            }

            BackgroundTaskManager taskManager = new BackgroundTaskManager(TASK_MANAGER_NAME);
            IdentityRefCounter refCounter = new IdentityRefCounter(new KeepAliveTasks(taskManager, backend));
            LocalIdentityCache localCache = new InMemoryLocalIdentityCache(
                config.getLocalMinId(), config.getLocalMaxId(), events);

            state = new AllocatorState(backend, localCache, taskManager, refCounter);
            globalReferences.set(0);
            readiness.markReady();
            log.info("Identity allocator initialized");
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Tear down everything {@link #init(IdentityAllocatorOwner)} created. Outstanding
     * keep-alive tasks are cancelled and waited for.
     *
     * @throws InvalidAllocatorStateException if the allocator is not initialized
     */
    public void close() {
        lifecycleLock.lock();
        try {
            AllocatorState current = state;
            if (current == null) {
                throw new InvalidAllocatorStateException("identity allocator not initialized");
            }
            log.info("Closing identity allocator");

            current.refCounter.clear();
            current.backend.close();
            watcher.stop();
            readiness.reset();
            state = null;
            current.taskManager.shutdown();
            globalReferences.set(0);
            log.info("Identity allocator closed");
        } finally {
            lifecycleLock.unlock();
        }
    }

    public boolean isInitialized() {
        return state != null;
    }

    public boolean isReady() {
        return readiness.isReady();
    }

    /**
     * Block until the allocator is initialized and the backend has applied its initial
     * listing of cluster-wide identities.
     */
    public void waitForInitialIdentities(OperationContext ctx)
            throws OperationCancelledException, BackendException, AllocatorNotInitializedException {
        awaitLiveState(ctx).backend.waitForInitialSync(ctx);
    }

    private AllocatorState awaitLiveState(OperationContext ctx)
            throws OperationCancelledException, AllocatorNotInitializedException {
        readiness.awaitReady(ctx);
        AllocatorState current = state;
        if (current == null) {
            throw new AllocatorNotInitializedException();
        }
        return current;
    }

    // =================================================================
    // ALLOCATION
    // =================================================================

    /**
     * True if {@code labels} resolves without the distributed backend.
     */
    public boolean allocationIsLocal(Labels labels) {
        return !IdentityScope.requiresGlobalIdentity(labels);
    }

    /**
     * Resolve {@code labels} to an identity, allocating one if needed. Every successful
     * call on a non-reserved label set must be paired with a {@link #release}.
     */
    public AllocationResult allocate(OperationContext ctx, Labels labels) throws IdentityAllocationException {
        Identity reserved = reservedIdentities.lookupReservedIdentityByLabels(labels);
        if (reserved != null) {
            countAllocation(SCOPE_RESERVED, false);
            return new AllocationResult(reserved, false);
        }

        if (allocationIsLocal(labels)) {
            AllocatorState current = state;
            if (current != null) {
                AllocationResult result = current.localCache.lookupOrCreate(labels);
                countAllocation(SCOPE_LOCAL, result.isNew());
                return result;
            }
        }

        long start = System.nanoTime();
        waitForInitialIdentities(ctx);
        AllocatorState current = awaitLiveState(ctx);
        if (allocationIsLocal(labels)) {
            AllocationResult result = current.localCache.lookupOrCreate(labels);
            countAllocation(SCOPE_LOCAL, result.isNew());
            return result;
        }

        BackendAllocation allocation = current.backend.allocate(ctx, labels.sortedList());
        Identity identity = new Identity(allocation.getId(), labels);
        int count = current.refCounter.acquire(identity);
        countAllocation(SCOPE_GLOBAL, allocation.isNew());
        globalReferences.set(current.refCounter.total());
        allocateLatency.record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
        log.debug("Allocated global identity {} (new: {}, local references: {})", identity, allocation.isNew(), count);
        return new AllocationResult(identity, allocation.isNew());
    }

    private void countAllocation(String scope, boolean isNew) {
        metricsProvider.counter(METRIC_ALLOCATIONS,
            Map.of(TAG_SCOPE, scope, TAG_OUTCOME, isNew ? OUTCOME_NEW : OUTCOME_REUSED)).increment();
    }

    /**
     * Drop one reference on {@code identity}.
     *
     * @return true iff this was the last use of the identity: in the cluster for global
     *         identities, on this node for local ones
     */
    public boolean release(OperationContext ctx, Identity identity) throws IdentityAllocationException {
        if (identity.isReserved()) {
            return false;
        }

        if (allocationIsLocal(identity.getLabels())) {
            AllocatorState current = state;
            if (current != null) {
                releases.increment();
                return current.localCache.release(identity);
            }
        }

        waitForInitialIdentities(ctx);
        AllocatorState current = awaitLiveState(ctx);
        if (allocationIsLocal(identity.getLabels())) {
            releases.increment();
            return current.localCache.release(identity);
        }

        boolean lastUse = current.backend.release(ctx, identity.getLabels().sortedList());
        int remaining = current.refCounter.release(identity.getId());
        releases.increment();
        globalReferences.set(current.refCounter.total());
        log.debug("Released global identity {} (local references left: {}, last use: {})", identity, remaining, lastUse);
        return lastUse;
    }

    /**
     * Release every identity in {@code identities}, skipping nulls. Failures do not stop
     * the batch; each is logged. The last failure is thrown with the earlier ones attached
     * as suppressed exceptions.
     */
    public void releaseSlice(OperationContext ctx, List<Identity> identities) throws IdentityAllocationException {
        IdentityAllocationException failure = null;
        for (Identity identity : identities) {
            if (identity == null) {
                continue;
            }
            try {
                release(ctx, identity);
            } catch (IdentityAllocationException e) {
                log.error("Failed to release identity {}: {}", identity, e.getMessage());
                releaseFailures.increment();
                if (failure != null) {
                    e.addSuppressed(failure);
                }
                failure = e;
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    // =================================================================
    // FEDERATION
    // =================================================================

    /**
     * Mirror the identities of another cluster reachable through {@code remoteClient}.
     * Blocks until the allocator is initialized; does not wait for the local initial sync.
     */
    public RemoteIdentityCache watchRemoteIdentities(OperationContext ctx, Client remoteClient, String basePath)
            throws OperationCancelledException, AllocatorNotInitializedException {
        AllocatorState current = awaitLiveState(ctx);
        return current.backend.watchRemoteBackend(remoteClient, basePath);
    }

    /**
     * Remote cluster sharing this cluster's key layout.
     */
    public RemoteIdentityCache watchRemoteIdentities(OperationContext ctx, Client remoteClient)
            throws OperationCancelledException, AllocatorNotInitializedException {
        return watchRemoteIdentities(ctx, remoteClient, config.getBasePath());
    }

    // =================================================================
    // LOOKUPS
    // =================================================================

    /**
     * Identity already known for {@code labels}, without allocating.
     */
    public Optional<Identity> lookupIdentity(Labels labels) {
        Identity reserved = reservedIdentities.lookupReservedIdentityByLabels(labels);
        if (reserved != null) {
            return Optional.of(reserved);
        }
        AllocatorState current = state;
        if (current == null) {
            return Optional.empty();
        }
        if (allocationIsLocal(labels)) {
            return Optional.ofNullable(current.localCache.lookup(labels));
        }
        return current.backend.getByKey(labels.sortedList()).map(id -> new Identity(id, labels));
    }

    public Optional<Identity> lookupIdentityById(long id) {
        Identity reserved = reservedIdentities.lookupById(id);
        if (reserved != null) {
            return Optional.of(reserved);
        }
        AllocatorState current = state;
        if (current == null) {
            return Optional.empty();
        }
        Identity local = current.localCache.lookupById(id);
        if (local != null) {
            return Optional.of(local);
        }
        return current.backend.getById(id).map(key -> new Identity(id, Labels.fromSortedList(key)));
    }

    /**
     * References this process holds on global identity {@code id}.
     */
    public int getGlobalReferenceCount(long id) {
        AllocatorState current = state;
        return current != null ? current.refCounter.getCount(id) : 0;
    }

    public Set<String> getKeepAliveTaskNames() {
        AllocatorState current = state;
        return current != null ? current.taskManager.getTaskNames() : Set.of();
    }

    /**
     * Run history of the keep-alive task of global identity {@code id}, if one is active.
     */
    public Optional<TaskStatus> getKeepAliveStatus(long id) {
        AllocatorState current = state;
        return current != null ? current.taskManager.getStatus(keepAliveTaskName(id)) : Optional.empty();
    }

    static String keepAliveTaskName(long id) {
        return KEEPALIVE_TASK_PREFIX + " (" + id + ")";
    }

    /**
     * Everything created by one init() and torn down by the matching close().
     */
    private static final class AllocatorState {
        private final DistributedAllocatorBackend backend;
        private final LocalIdentityCache localCache;
        private final BackgroundTaskManager taskManager;
        private final IdentityRefCounter refCounter;

        private AllocatorState(DistributedAllocatorBackend backend, LocalIdentityCache localCache,
                               BackgroundTaskManager taskManager, IdentityRefCounter refCounter) {
            this.backend = backend;
            this.localCache = localCache;
            this.taskManager = taskManager;
            this.refCounter = refCounter;
        }
    }

    /**
     * One task per referenced identity, periodically re-asserting this node's use of it.
     */
    private final class KeepAliveTasks implements IdentityRefCounter.KeepAliveScheduler {
        private final BackgroundTaskManager taskManager;
        private final DistributedAllocatorBackend backend;

        private KeepAliveTasks(BackgroundTaskManager taskManager, DistributedAllocatorBackend backend) {
            this.taskManager = taskManager;
            this.backend = backend;
        }

        @Override
        public void arm(Identity identity) {
            String key = identity.getLabels().sortedList();
            Duration interval = config.getKeepAliveInterval();
            taskManager.updateOrCreateTask(keepAliveTaskName(identity.getId()), ctx -> {
                ctx.sleep(interval);
                // a refresh has to finish before the next one is due
                backend.reassert(ctx.child(interval), key);
            }, KEEPALIVE_RUN_INTERVAL);
        }

        @Override
        public void disarm(long id) {
            taskManager.removeTaskAndWait(keepAliveTaskName(id));
        }

        @Override
        public void disarmAll() {
            taskManager.removeAllTasksAndWait();
        }
    }
}
