package io.identityallocator.backend;

import io.identityallocator.exceptions.BackendException;

/**
 * Creates the distributed backend once the event watcher is listening.
 */
@FunctionalInterface
public interface AllocatorBackendFactory {

    DistributedAllocatorBackend create(AllocatorBackendOptions options) throws BackendException;
}
