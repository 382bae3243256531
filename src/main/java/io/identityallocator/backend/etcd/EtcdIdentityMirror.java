package io.identityallocator.backend.etcd;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Watch;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.WatchOption;
import io.etcd.jetcd.watch.WatchEvent;
import io.etcd.jetcd.watch.WatchResponse;
import io.identityallocator.backend.AllocatorEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * In-memory copy of the master keys below one {@link EtcdKeyLayout}: lists them once,
 * then follows changes with a watch starting right after the listed revision. Every
 * change is forwarded to the event queue.
 */
@Slf4j
class EtcdIdentityMirror implements AutoCloseable {

    private final String name;
    private final EtcdKeyLayout layout;
    private final KV kvClient;
    private final Watch watchClient;
    private final BlockingQueue<AllocatorEvent> events;

    private final Map<Long, String> idToKey = new ConcurrentHashMap<>();
    private final Map<String, Long> keyToId = new ConcurrentHashMap<>();
    private final CompletableFuture<Void> synced = new CompletableFuture<>();

    private volatile Watch.Watcher watcher;
    private volatile boolean closed;

    EtcdIdentityMirror(String name, EtcdKeyLayout layout, KV kvClient, Watch watchClient,
                       BlockingQueue<AllocatorEvent> events) {
        this.name = name;
        this.layout = layout;
        this.kvClient = kvClient;
        this.watchClient = watchClient;
        this.events = events;
    }

    /**
     * Issue the initial listing. Returns immediately; {@link #syncFuture()} completes once
     * the listing is applied and the watch is in place.
     */
    void start() {
        ByteSequence prefix = ByteSequence.from(layout.getIdPrefix(), UTF_8);
        kvClient.get(prefix, GetOption.newBuilder().withPrefix(prefix).build())
            .thenAccept(this::applyListing)
            .whenComplete((ignored, error) -> {
                if (error != null) {
                    log.error("[{}] Initial identity listing of {} failed: {}", name, layout.getIdPrefix(), error.getMessage());
                    synced.completeExceptionally(error);
                }
            });
    }

    private void applyListing(GetResponse response) {
        for (KeyValue kv : response.getKvs()) {
            upsert(kv.getKey().toString(UTF_8), kv.getValue().toString(UTF_8));
        }
        long revision = response.getHeader().getRevision();
        log.info("[{}] Listed {} identities below {} at revision {}", name, idToKey.size(), layout.getBasePath(), revision);

        synchronized (this) {
            if (!closed) {
                ByteSequence prefix = ByteSequence.from(layout.getIdPrefix(), UTF_8);
                watcher = watchClient.watch(prefix,
                    WatchOption.newBuilder().withPrefix(prefix).withRevision(revision + 1).build(),
                    new IdListener());
            }
        }
        synced.complete(null);
    }

    private void upsert(String path, String key) {
        long id = layout.parseIdPath(path);
        if (id < 0) {
            log.warn("[{}] Ignoring unexpected key {}", name, path);
            return;
        }
        String previous = idToKey.put(id, key);
        if (previous != null && !previous.equals(key)) {
            keyToId.remove(previous, id);
        }
        keyToId.put(key, id);
        publish(AllocatorEvent.upsert(id, key));
    }

    private void delete(String path) {
        long id = layout.parseIdPath(path);
        if (id < 0) {
            return;
        }
        String key = idToKey.remove(id);
        if (key != null) {
            keyToId.remove(key, id);
        }
        publish(AllocatorEvent.delete(id, key));
    }

    private void publish(AllocatorEvent event) {
        if (!events.offer(event)) {
            log.warn("[{}] Identity event queue full, dropping {} event for {}", name, event.getType(), event.getId());
        }
    }

    /**
     * Record an id this node just created, ahead of the watch event for it.
     */
    void remember(long id, String key) {
        idToKey.put(id, key);
        keyToId.put(key, id);
    }

    boolean containsId(long id) {
        return idToKey.containsKey(id);
    }

    Optional<String> getById(long id) {
        return Optional.ofNullable(idToKey.get(id));
    }

    Optional<Long> getByKey(String key) {
        return Optional.ofNullable(keyToId.get(key));
    }

    int size() {
        return idToKey.size();
    }

    CompletableFuture<Void> syncFuture() {
        return synced;
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (watcher != null) {
            watcher.close();
            watcher = null;
        }
        log.debug("[{}] Stopped mirroring {}", name, layout.getBasePath());
    }

    private class IdListener implements Watch.Listener {
        @Override
        public void onNext(WatchResponse watchResponse) {
            for (WatchEvent event : watchResponse.getEvents()) {
                String path = event.getKeyValue().getKey().toString(UTF_8);
                switch (event.getEventType()) {
                    case PUT:
                        upsert(path, event.getKeyValue().getValue().toString(UTF_8));
                        break;
                    case DELETE:
                        delete(path);
                        break;
                    default:
                        break;
                }
            }
        }

        @Override
        public void onError(Throwable throwable) {
            log.error("[{}] Error in identity watcher for {}", name, layout.getBasePath(), throwable);
        }

        @Override
        public void onCompleted() {
            log.debug("[{}] Identity watch for {} completed", name, layout.getBasePath());
        }
    }
}
