package io.identityallocator.allocator;

import io.etcd.jetcd.Client;
import io.identityallocator.backend.AllocatorBackendFactory;
import io.identityallocator.backend.RemoteIdentityCache;
import io.identityallocator.config.IdentityAllocatorConfig;
import io.identityallocator.context.OperationContext;
import io.identityallocator.exceptions.BackendException;
import io.identityallocator.exceptions.IdentityAllocationException;
import io.identityallocator.exceptions.InvalidAllocatorStateException;
import io.identityallocator.exceptions.OperationCancelledException;
import io.identityallocator.identity.AllocationResult;
import io.identityallocator.identity.Identity;
import io.identityallocator.identity.ReservedIdentities;
import io.identityallocator.labels.Labels;
import io.identityallocator.metrics.MetricsProvider;
import io.identityallocator.tasks.TaskStatus;
import io.identityallocator.watcher.IdentityWatcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static io.identityallocator.config.Constants.LOCAL_IDENTITY_FLAG;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IdentityAllocatorManagerTest {

    private static final Labels APP_FOO = Labels.parse("k8s:app=foo");
    private static final Labels APP_BAR = Labels.parse("k8s:app=bar");
    private static final Labels APP_BAZ = Labels.parse("k8s:app=baz");
    private static final Labels CIDR = Labels.parse("cidr:10.0.0.0/8");

    private IdentityAllocatorConfig config;
    private AllocatorBackendFactory factory;
    private SimpleMeterRegistry registry;
    private IdentityWatcher watcher;
    private List<FakeAllocatorBackend> backends;
    private boolean syncBackends;
    private Boolean watcherRunningAtBackendCreation;
    private IdentityAllocatorOwner owner;
    private IdentityAllocatorManager manager;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        watcher = new IdentityWatcher();
        backends = new ArrayList<>();
        syncBackends = true;
        registry = new SimpleMeterRegistry();
        factory = options -> {
            watcherRunningAtBackendCreation = watcher.isRunning();
            FakeAllocatorBackend backend = new FakeAllocatorBackend(options, syncBackends);
            backends.add(backend);
            return backend;
        };

        owner = mock(IdentityAllocatorOwner.class);
        when(owner.getNodeSuffix()).thenReturn("node-1");

        manager = newManager(null);
        executor = Executors.newCachedThreadPool();
    }

    private IdentityAllocatorManager newManager(Long keepaliveSeconds) {
        IdentityAllocatorConfig.IdentitySection identity = new IdentityAllocatorConfig.IdentitySection();
        identity.setNodeName("node-1");
        identity.setClusterName("test-cluster");
        identity.setKeepaliveSeconds(keepaliveSeconds);
        IdentityAllocatorConfig.ConfigModel model = new IdentityAllocatorConfig.ConfigModel();
        model.setIdentity(identity);
        config = new IdentityAllocatorConfig(model);
        return new IdentityAllocatorManager(config, factory, new ReservedIdentities(),
            new MetricsProvider(registry, "node-1"), watcher);
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            assertThat(System.nanoTime()).as("condition not met in time").isLessThan(deadline);
            Thread.sleep(20);
        }
    }

    @AfterEach
    void tearDown() {
        if (manager.isInitialized()) {
            manager.close();
        }
        executor.shutdownNow();
    }

    private static OperationContext ctx() {
        return OperationContext.withTimeout(Duration.ofSeconds(5));
    }

    private FakeAllocatorBackend backend() {
        return backends.get(backends.size() - 1);
    }

    // =================================================================
    // RESERVED AND LOCAL
    // =================================================================

    @Test
    void testAllocateReservedWithoutInit() throws Exception {
        AllocationResult result = manager.allocate(ctx(), Labels.parse("reserved:host"));

        assertThat(result.getIdentity().getId()).isEqualTo(ReservedIdentities.IDENTITY_HOST);
        assertThat(result.isNew()).isFalse();
        assertThat(backends).isEmpty();
    }

    @Test
    void testAllocateWellKnownAfterInit() throws Exception {
        manager.init(owner);

        Labels coreDns = Labels.parse(
            "k8s:k8s-app=kube-dns",
            "k8s:io.kubernetes.pod.namespace=kube-system",
            "k8s:policy.serviceaccount=coredns",
            "k8s:policy.cluster=test-cluster");
        AllocationResult result = manager.allocate(ctx(), coreDns);

        assertThat(result.getIdentity().getId()).isEqualTo(ReservedIdentities.IDENTITY_CORE_DNS);
        assertThat(result.isNew()).isFalse();
        assertThat(backend().allocateCalls).isZero();
        assertThat(manager.getGlobalReferenceCount(ReservedIdentities.IDENTITY_CORE_DNS)).isZero();
    }

    @Test
    void testReleaseReservedIsNoOp() throws Exception {
        Identity host = manager.allocate(ctx(), Labels.parse("reserved:host")).getIdentity();

        assertThat(manager.release(ctx(), host)).isFalse();
        assertThat(backends).isEmpty();
    }

    @Test
    void testLocalScopeAllocationBypassesBackend() throws Exception {
        manager.init(owner);

        AllocationResult first = manager.allocate(ctx(), CIDR);
        AllocationResult second = manager.allocate(ctx(), CIDR);

        assertThat(first.isNew()).isTrue();
        assertThat(second.isNew()).isFalse();
        assertThat(second.getIdentity()).isEqualTo(first.getIdentity());
        assertThat(first.getIdentity().getId() & LOCAL_IDENTITY_FLAG).isNotZero();
        assertThat(manager.allocationIsLocal(CIDR)).isTrue();
        assertThat(backend().allocateCalls).isZero();
        assertThat(manager.getKeepAliveTaskNames()).isEmpty();

        assertThat(manager.release(ctx(), first.getIdentity())).isFalse();
        assertThat(manager.release(ctx(), first.getIdentity())).isTrue();
        assertThat(backend().releasedKeys).isEmpty();
    }

    @Test
    void testLocalAllocationTriggersPolicyUpdate() throws Exception {
        manager.init(owner);

        manager.allocate(ctx(), CIDR);

        verify(owner, timeout(2000).atLeastOnce()).triggerPolicyUpdates(anyBoolean(), anyString());
    }

    // =================================================================
    // GLOBAL
    // =================================================================

    @Test
    void testConcurrentGlobalAllocationSharesOneKeepAliveTask() throws Exception {
        manager.init(owner);
        CountDownLatch start = new CountDownLatch(1);
        Callable<AllocationResult> allocateFoo = () -> {
            start.await();
            return manager.allocate(ctx(), APP_FOO);
        };
        List<Future<AllocationResult>> futures = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            futures.add(executor.submit(allocateFoo));
        }
        start.countDown();

        List<AllocationResult> results = new ArrayList<>();
        for (Future<AllocationResult> future : futures) {
            results.add(future.get(5, TimeUnit.SECONDS));
        }

        long id = results.get(0).getIdentity().getId();
        assertThat(results).extracting(r -> r.getIdentity().getId()).containsOnly(id);
        assertThat(results).filteredOn(AllocationResult::isNew).hasSize(1);
        assertThat(manager.getGlobalReferenceCount(id)).isEqualTo(3);
        assertThat(manager.getKeepAliveTaskNames()).containsExactly("sync-identity (" + id + ")");

        Identity identity = results.get(0).getIdentity();
        assertThat(manager.release(ctx(), identity)).isFalse();
        assertThat(manager.release(ctx(), identity)).isFalse();
        assertThat(manager.getKeepAliveTaskNames()).hasSize(1);
        assertThat(manager.release(ctx(), identity)).isTrue();

        assertThat(manager.getGlobalReferenceCount(id)).isZero();
        assertThat(manager.getKeepAliveTaskNames()).isEmpty();
    }

    @Test
    void testAllocationsCountedByScopeAndOutcome() throws Exception {
        manager.init(owner);
        manager.allocate(ctx(), APP_FOO);
        manager.allocate(ctx(), APP_FOO);
        manager.allocate(ctx(), CIDR);
        manager.allocate(ctx(), Labels.parse("reserved:host"));

        assertThat(allocations("global", "new")).isEqualTo(1.0);
        assertThat(allocations("global", "reused")).isEqualTo(1.0);
        assertThat(allocations("local", "new")).isEqualTo(1.0);
        assertThat(allocations("reserved", "reused")).isEqualTo(1.0);
    }

    private double allocations(String scope, String outcome) {
        return registry.get("identity.allocations").tag("scope", scope).tag("outcome", outcome).counter().count();
    }

    // =================================================================
    // KEEP-ALIVE
    // =================================================================

    @Test
    void testKeepAliveReassertsCanonicalKey() throws Exception {
        manager = newManager(1L);
        manager.init(owner);
        long id = manager.allocate(ctx(), APP_FOO).getIdentity().getId();

        awaitCondition(() -> backend().reassertedKeys.contains(APP_FOO.sortedList()));

        awaitCondition(() -> manager.getKeepAliveStatus(id).map(TaskStatus::getSuccessCount).orElse(0L) >= 1);
        assertThat(backend().allocateCalls).isEqualTo(1);
    }

    @Test
    void testKeepAliveFailureKeepsTaskRunning() throws Exception {
        manager = newManager(1L);
        manager.init(owner);
        backend().reassertFailure = new BackendException("etcd unavailable");
        long id = manager.allocate(ctx(), APP_FOO).getIdentity().getId();

        awaitCondition(() -> manager.getKeepAliveStatus(id).map(TaskStatus::getFailureCount).orElse(0L) >= 1);

        assertThat(manager.getKeepAliveTaskNames()).containsExactly("sync-identity (" + id + ")");
        assertThat(manager.getKeepAliveStatus(id).get().getLastError()).isEqualTo("etcd unavailable");

        backend().reassertFailure = null;
        awaitCondition(() -> backend().reassertedKeys.contains(APP_FOO.sortedList()));
    }

    @Test
    void testTimedOutKeepAliveCycleIsSkipped() throws Exception {
        manager = newManager(1L);
        manager.init(owner);
        backend().reassertHangs = true;
        Identity identity = manager.allocate(ctx(), APP_FOO).getIdentity();
        long id = identity.getId();

        awaitCondition(() -> backend().reassertCancellations.get() >= 1);

        assertThat(manager.getKeepAliveTaskNames()).containsExactly("sync-identity (" + id + ")");
        TaskStatus status = manager.getKeepAliveStatus(id).get();
        assertThat(status.getFailureCount()).isZero();

        backend().reassertHangs = false;
        awaitCondition(() -> backend().reassertedKeys.contains(APP_FOO.sortedList()));

        assertThat(manager.release(ctx(), identity)).isTrue();
        assertThat(manager.getKeepAliveTaskNames()).isEmpty();
    }

    @Test
    void testReleaseBeyondZeroIsSafe() throws Exception {
        manager.init(owner);
        Identity identity = manager.allocate(ctx(), APP_FOO).getIdentity();
        manager.release(ctx(), identity);

        assertThat(manager.release(ctx(), identity)).isFalse();
        assertThat(manager.getGlobalReferenceCount(identity.getId())).isZero();
        assertThat(manager.getKeepAliveTaskNames()).isEmpty();
    }

    @Test
    void testBackendAllocateFailureLeavesCountsUntouched() throws Exception {
        manager.init(owner);
        backend().allocateFailure = new BackendException("etcd unavailable");

        assertThatThrownBy(() -> manager.allocate(ctx(), APP_FOO))
            .isInstanceOf(BackendException.class)
            .hasMessage("etcd unavailable");
        assertThat(manager.getKeepAliveTaskNames()).isEmpty();
    }

    @Test
    void testBackendReleaseFailureKeepsReference() throws Exception {
        manager.init(owner);
        Identity identity = manager.allocate(ctx(), APP_FOO).getIdentity();
        backend().failingReleases.add(APP_FOO.sortedList());

        assertThatThrownBy(() -> manager.release(ctx(), identity)).isInstanceOf(BackendException.class);
        assertThat(manager.getGlobalReferenceCount(identity.getId())).isEqualTo(1);
        assertThat(manager.getKeepAliveTaskNames()).hasSize(1);
    }

    @Test
    void testGlobalAllocateBlocksUntilInit() throws Exception {
        CompletableFuture<AllocationResult> pending = CompletableFuture.supplyAsync(() -> {
            try {
                return manager.allocate(OperationContext.withTimeout(Duration.ofSeconds(10)), APP_FOO);
            } catch (IdentityAllocationException e) {
                throw new IllegalStateException(e);
            }
        }, executor);

        Thread.sleep(200);
        assertThat(pending).isNotDone();

        manager.init(owner);

        AllocationResult result = pending.get(5, TimeUnit.SECONDS);
        assertThat(result.isNew()).isTrue();
        assertThat(manager.getGlobalReferenceCount(result.getIdentity().getId())).isEqualTo(1);
    }

    @Test
    void testGlobalAllocateWaitsForInitialSync() throws Exception {
        syncBackends = false;
        manager.init(owner);

        assertThatThrownBy(() -> manager.allocate(OperationContext.withTimeout(Duration.ofMillis(200)), APP_FOO))
            .isInstanceOf(OperationCancelledException.class);
        assertThat(backend().allocateCalls).isZero();

        backend().synced.complete(null);
        assertThat(manager.allocate(ctx(), APP_FOO).isNew()).isTrue();
    }

    @Test
    void testCancelledContextFailsPromptly() {
        OperationContext ctx = OperationContext.background();
        ctx.cancel();

        assertThatThrownBy(() -> manager.waitForInitialIdentities(ctx))
            .isInstanceOf(OperationCancelledException.class)
            .hasMessage("operation cancelled");
    }

    // =================================================================
    // LIFECYCLE
    // =================================================================

    @Test
    void testDoubleInitIsRejected() throws Exception {
        manager.init(owner);

        assertThatThrownBy(() -> manager.init(owner))
            .isInstanceOf(InvalidAllocatorStateException.class)
            .hasMessageContaining("already initialized");
        assertThat(backends).hasSize(1);
    }

    @Test
    void testCloseWithoutInitIsRejected() {
        assertThatThrownBy(() -> manager.close())
            .isInstanceOf(InvalidAllocatorStateException.class)
            .hasMessageContaining("not initialized");
    }

    @Test
    void testWatcherStartsBeforeBackend() throws Exception {
        manager.init(owner);

        assertThat(watcherRunningAtBackendCreation).isTrue();
        assertThat(backend().options.getSuffix()).isEqualTo("node-1");
        assertThat(backend().options.isMasterKeyProtection()).isTrue();
    }

    @Test
    void testCloseTearsDownAndReinitStartsFresh() throws Exception {
        manager.init(owner);
        Identity identity = manager.allocate(ctx(), APP_FOO).getIdentity();
        manager.allocate(ctx(), APP_BAR);
        assertThat(manager.getKeepAliveTaskNames()).hasSize(2);
        FakeAllocatorBackend first = backend();

        manager.close();

        assertThat(first.closed).isTrue();
        assertThat(watcher.isRunning()).isFalse();
        assertThat(manager.isReady()).isFalse();
        assertThat(manager.isInitialized()).isFalse();
        assertThat(manager.getKeepAliveTaskNames()).isEmpty();

        manager.init(owner);

        assertThat(backends).hasSize(2);
        assertThat(manager.isReady()).isTrue();
        assertThat(manager.getGlobalReferenceCount(identity.getId())).isZero();
        assertThat(manager.getKeepAliveTaskNames()).isEmpty();
    }

    @Test
    void testGlobalAllocateAfterCloseBlocks() throws Exception {
        manager.init(owner);
        manager.close();

        assertThatThrownBy(() -> manager.allocate(OperationContext.withTimeout(Duration.ofMillis(100)), APP_FOO))
            .isInstanceOf(OperationCancelledException.class);
    }

    // =================================================================
    // BATCH RELEASE
    // =================================================================

    @Test
    void testReleaseSliceContinuesPastFailures() throws Exception {
        manager.init(owner);
        Identity id1 = manager.allocate(ctx(), APP_FOO).getIdentity();
        Identity id2 = manager.allocate(ctx(), APP_BAR).getIdentity();
        Identity id3 = manager.allocate(ctx(), APP_BAZ).getIdentity();
        backend().failingReleases.add(APP_BAR.sortedList());

        assertThatThrownBy(() -> manager.releaseSlice(ctx(), Arrays.asList(id1, null, id2, id3)))
            .isInstanceOf(BackendException.class)
            .hasMessageContaining(APP_BAR.sortedList());

        assertThat(backend().releasedKeys).containsExactly(APP_FOO.sortedList(), APP_BAZ.sortedList());
        assertThat(manager.getGlobalReferenceCount(id1.getId())).isZero();
        assertThat(manager.getGlobalReferenceCount(id2.getId())).isEqualTo(1);
        assertThat(manager.getGlobalReferenceCount(id3.getId())).isZero();
    }

    @Test
    void testReleaseSliceKeepsEarlierFailuresAsSuppressed() throws Exception {
        manager.init(owner);
        Identity id1 = manager.allocate(ctx(), APP_FOO).getIdentity();
        Identity id2 = manager.allocate(ctx(), APP_BAR).getIdentity();
        backend().failingReleases.add(APP_FOO.sortedList());
        backend().failingReleases.add(APP_BAR.sortedList());

        assertThatThrownBy(() -> manager.releaseSlice(ctx(), List.of(id1, id2)))
            .hasMessageContaining(APP_BAR.sortedList())
            .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1)
                .allSatisfy(s -> assertThat(s).hasMessageContaining(APP_FOO.sortedList())));
    }

    // =================================================================
    // FEDERATION AND LOOKUPS
    // =================================================================

    @Test
    void testWatchRemoteIdentitiesWaitsForInit() throws Exception {
        Client remote = mock(Client.class);

        assertThatThrownBy(() -> manager.watchRemoteIdentities(OperationContext.withTimeout(Duration.ofMillis(100)), remote))
            .isInstanceOf(OperationCancelledException.class);

        syncBackends = false;
        manager.init(owner);
        RemoteIdentityCache cache = manager.watchRemoteIdentities(ctx(), remote);

        assertThat(cache).isNotNull();
        assertThat(cache.isSynced()).isTrue();
    }

    @Test
    void testLookups() throws Exception {
        assertThat(manager.lookupIdentity(APP_FOO)).isEmpty();
        assertThat(manager.lookupIdentityById(ReservedIdentities.IDENTITY_WORLD).get().getLabels())
            .isEqualTo(Labels.parse("reserved:world"));

        manager.init(owner);
        Identity global = manager.allocate(ctx(), APP_FOO).getIdentity();
        Identity local = manager.allocate(ctx(), CIDR).getIdentity();

        assertThat(manager.lookupIdentity(APP_FOO)).contains(global);
        assertThat(manager.lookupIdentity(CIDR)).contains(local);
        assertThat(manager.lookupIdentity(APP_BAR)).isEmpty();
        assertThat(manager.lookupIdentityById(global.getId()).get().getLabels()).isEqualTo(APP_FOO);
        assertThat(manager.lookupIdentityById(local.getId())).contains(local);
    }
}
