package io.identityallocator.backend.etcd;

import io.etcd.jetcd.Client;
import io.identityallocator.backend.AllocatorBackendFactory;
import io.identityallocator.backend.AllocatorBackendOptions;
import io.identityallocator.backend.DistributedAllocatorBackend;
import io.identityallocator.exceptions.BackendException;

/**
 * Builds etcd backends sharing one client.
 */
public class EtcdAllocatorBackendFactory implements AllocatorBackendFactory {

    private final Client etcdClient;

    public EtcdAllocatorBackendFactory(Client etcdClient) {
        this.etcdClient = etcdClient;
    }

    @Override
    public DistributedAllocatorBackend create(AllocatorBackendOptions options) throws BackendException {
        return new EtcdAllocatorBackend(etcdClient, options);
    }
}
