package io.identityallocator.backend;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.concurrent.BlockingQueue;

/**
 * Construction-time settings of a distributed allocator backend.
 */
@Value
@Builder
public class AllocatorBackendOptions {
    /** Key space root, e.g. /identity-allocator/state/identities/v1 */
    @NonNull String basePath;
    long minId;
    long maxId;
    /** OR'ed into every allocated id; carries the cluster id. */
    long prefixMask;
    /** Per-node suffix for this node's slave keys. */
    @NonNull String suffix;
    /** Receives upserts and deletions, must already be drained when the backend is built. */
    @NonNull BlockingQueue<AllocatorEvent> events;
    /** Recreate a missing master key whenever a held key is re-asserted. */
    boolean masterKeyProtection;
    long leaseTtlSeconds;
}
