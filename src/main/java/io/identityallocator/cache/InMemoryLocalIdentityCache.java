package io.identityallocator.cache;

import io.identityallocator.backend.AllocatorEvent;
import io.identityallocator.exceptions.IdentityAllocationException;
import io.identityallocator.identity.AllocationResult;
import io.identityallocator.identity.Identity;
import io.identityallocator.labels.Labels;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;

import static io.identityallocator.config.Constants.LOCAL_IDENTITY_FLAG;

/**
 * Refcounted in-memory local identity cache. Numbers are handed out from
 * [{@code minId}, {@code maxId}] with the local-scope flag set, the next search starting
 * after the last number handed out.
 */
@Slf4j
public class InMemoryLocalIdentityCache implements LocalIdentityCache {

    private final long minId;
    private final long maxId;
    private final BlockingQueue<AllocatorEvent> events;

    private final Map<String, Entry> byKey = new HashMap<>();
    private final Map<Long, Entry> byId = new HashMap<>();
    private long nextId;

    public InMemoryLocalIdentityCache(long minId, long maxId, BlockingQueue<AllocatorEvent> events) {
        if (minId <= 0 || minId > maxId || maxId >= LOCAL_IDENTITY_FLAG) {
            throw new IllegalArgumentException("invalid local identity range [" + minId + ", " + maxId + "]");
        }
        this.minId = minId;
        this.maxId = maxId;
        this.events = events;
        this.nextId = minId;
    }

    @Override
    public synchronized AllocationResult lookupOrCreate(Labels labels) throws IdentityAllocationException {
        String key = labels.sortedList();
        Entry entry = byKey.get(key);
        if (entry != null) {
            entry.refCount++;
            return new AllocationResult(entry.identity, false);
        }

        long id = nextFreeId();
        Identity identity = new Identity(id | LOCAL_IDENTITY_FLAG, labels);
        entry = new Entry(identity);
        byKey.put(key, entry);
        byId.put(identity.getId(), entry);
        log.debug("Created local identity {}", identity);
        publish(AllocatorEvent.upsert(identity.getId(), key));
        return new AllocationResult(identity, true);
    }

    private long nextFreeId() throws IdentityAllocationException {
        long span = maxId - minId + 1;
        for (long i = 0; i < span; i++) {
            long candidate = nextId;
            nextId = candidate == maxId ? minId : candidate + 1;
            if (!byId.containsKey(candidate | LOCAL_IDENTITY_FLAG)) {
                return candidate;
            }
        }
        throw new IdentityAllocationException("local identity space exhausted");
    }

    @Override
    public synchronized boolean release(Identity identity) {
        Entry entry = byId.get(identity.getId());
        if (entry == null) {
            return false;
        }
        if (--entry.refCount > 0) {
            return false;
        }
        byId.remove(identity.getId());
        String key = entry.identity.getLabels().sortedList();
        byKey.remove(key);
        log.debug("Removed local identity {}", entry.identity);
        publish(AllocatorEvent.delete(identity.getId(), key));
        return true;
    }

    private void publish(AllocatorEvent event) {
        if (events != null && !events.offer(event)) {
            log.warn("Identity event queue full, dropping {} event for {}", event.getType(), event.getId());
        }
    }

    @Override
    public synchronized Identity lookup(Labels labels) {
        Entry entry = byKey.get(labels.sortedList());
        return entry != null ? entry.identity : null;
    }

    @Override
    public synchronized Identity lookupById(long id) {
        Entry entry = byId.get(id);
        return entry != null ? entry.identity : null;
    }

    @Override
    public synchronized int size() {
        return byId.size();
    }

    private static final class Entry {
        private final Identity identity;
        private int refCount = 1;

        private Entry(Identity identity) {
            this.identity = identity;
        }
    }
}
