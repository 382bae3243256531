package io.identityallocator.backend;

import io.etcd.jetcd.Client;
import io.identityallocator.context.OperationContext;
import io.identityallocator.exceptions.BackendException;
import io.identityallocator.exceptions.OperationCancelledException;

import java.util.Optional;

/**
 * Cluster-wide allocator mapping canonical keys to unique numeric ids.
 * Abstraction over the storage backend so the orchestration logic can be exercised
 * without one.
 */
public interface DistributedAllocatorBackend {

    /**
     * Resolve {@code key} to a cluster-wide id, creating one if the key is unknown,
     * and take one node-local reference on it.
     */
    BackendAllocation allocate(OperationContext ctx, String key)
        throws OperationCancelledException, BackendException;

    /**
     * Re-assert that this node still uses {@code key}: runs the allocate path again
     * (rewriting the node's key and, with master key protection, the master key) without
     * taking an additional node-local reference.
     */
    BackendAllocation reassert(OperationContext ctx, String key)
        throws OperationCancelledException, BackendException;

    /**
     * Drop one node-local reference on {@code key}.
     *
     * @return true iff no node in the cluster holds the key any more
     */
    boolean release(OperationContext ctx, String key)
        throws OperationCancelledException, BackendException;

    /**
     * Block until the initial listing of existing identities has been applied.
     */
    void waitForInitialSync(OperationContext ctx) throws OperationCancelledException, BackendException;

    /**
     * Key cached for {@code id}, without contacting the backend.
     */
    Optional<String> getById(long id);

    /**
     * Id cached for {@code key}, without contacting the backend.
     */
    Optional<Long> getByKey(String key);

    /**
     * Mirror the identities another cluster stores under {@code keyPrefix} into this
     * allocator's view.
     */
    RemoteIdentityCache watchRemoteBackend(Client remoteClient, String keyPrefix);

    void close();
}
