package io.identityallocator.backend;

import java.util.Optional;

/**
 * Read-only mirror of another cluster's identities. Closing it stops the subscription.
 */
public interface RemoteIdentityCache extends AutoCloseable {

    /**
     * True once the initial listing of the remote key space has been applied.
     */
    boolean isSynced();

    int size();

    Optional<String> getById(long id);

    @Override
    void close();
}
