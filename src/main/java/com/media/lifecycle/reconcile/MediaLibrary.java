package com.media.lifecycle.reconcile;

import com.media.lifecycle.core.model.MediaItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The canonical media collection, keyed by media id.
 *
 * <p>Guarded by one read/write lock: queries share the read lock, while ingest, policy
 * application and deletion take the write lock. Items handed out by the public
 * accessors are copies.</p>
 */
public class MediaLibrary {

    private final Map<String, MediaItem> items = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Runs a query under the read lock. The reader must not mutate the items.
     */
    <R> R read(Function<Map<String, MediaItem>, R> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(Collections.unmodifiableMap(items));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs a mutation under the write lock.
     */
    <R> R write(Function<Map<String, MediaItem>, R> writer) {
        lock.writeLock().lock();
        try {
            return writer.apply(items);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Applies an update to one item under the write lock.
     *
     * @return false if the item is absent
     */
    boolean update(String id, Consumer<MediaItem> mutation) {
        return write(map -> {
            MediaItem item = map.get(id);
            if (item == null) {
                return false;
            }
            mutation.accept(item);
            return true;
        });
    }

    /**
     * Adds or replaces items, keyed by their id.
     */
    void putAll(List<MediaItem> newItems) {
        write(map -> {
            for (MediaItem item : newItems) {
                map.put(item.getId(), item);
            }
            return null;
        });
    }

    Optional<MediaItem> remove(String id) {
        return write(map -> Optional.ofNullable(map.remove(id)));
    }

    public Optional<MediaItem> get(String id) {
        return read(map -> Optional.ofNullable(map.get(id)).map(MediaItem::copy));
    }

    public List<MediaItem> snapshot() {
        return read(map -> {
            List<MediaItem> copies = new ArrayList<>(map.size());
            for (MediaItem item : map.values()) {
                copies.add(item.copy());
            }
            return Collections.unmodifiableList(copies);
        });
    }

    public Map<String, MediaItem> snapshotMap() {
        return read(map -> {
            Map<String, MediaItem> copies = new LinkedHashMap<>();
            map.forEach((id, item) -> copies.put(id, item.copy()));
            return Collections.unmodifiableMap(copies);
        });
    }

    public int size() {
        return read(Map::size);
    }
}
