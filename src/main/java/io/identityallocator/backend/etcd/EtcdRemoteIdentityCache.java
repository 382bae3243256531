package io.identityallocator.backend.etcd;

import io.identityallocator.backend.RemoteIdentityCache;

import java.util.Optional;

/**
 * Identities of another cluster, followed through that cluster's etcd client.
 */
public class EtcdRemoteIdentityCache implements RemoteIdentityCache {

    private final EtcdIdentityMirror mirror;

    EtcdRemoteIdentityCache(EtcdIdentityMirror mirror) {
        this.mirror = mirror;
    }

    @Override
    public boolean isSynced() {
        return mirror.syncFuture().isDone() && !mirror.syncFuture().isCompletedExceptionally();
    }

    @Override
    public int size() {
        return mirror.size();
    }

    @Override
    public Optional<String> getById(long id) {
        return mirror.getById(id);
    }

    @Override
    public void close() {
        mirror.close();
    }
}
