package io.identityallocator.backend;

import lombok.Value;

/**
 * Change to the set of known identities, emitted by the backend and the local cache.
 */
@Value
public class AllocatorEvent {

    public enum EventType {
        UPSERT,
        DELETE
    }

    EventType type;
    long id;
    /** Canonical label key, null for deletions whose key is no longer known. */
    String key;

    public static AllocatorEvent upsert(long id, String key) {
        return new AllocatorEvent(EventType.UPSERT, id, key);
    }

    public static AllocatorEvent delete(long id, String key) {
        return new AllocatorEvent(EventType.DELETE, id, key);
    }
}
