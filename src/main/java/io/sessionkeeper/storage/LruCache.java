package io.sessionkeeper.storage;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Fixed-capacity cache evicting the least recently accessed key.
 *
 * <p>Both {@link #get} and {@link #put} count as an access. All operations share one monitor since
 * an access-ordered {@link LinkedHashMap} reorders itself on reads.
 */
public final class LruCache<K, V> {
    private final int capacity;
    private final LinkedHashMap<K, V> entries;

    public LruCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > LruCache.this.capacity;
            }
        };
    }

    public synchronized Optional<V> get(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    public synchronized void put(K key, V value) {
        if (value == null) {
            entries.remove(key);
            return;
        }
        entries.put(key, value);
    }

    public synchronized boolean remove(K key) {
        return entries.remove(key) != null;
    }

    public synchronized int removeIf(Predicate<K> keyFilter) {
        int removed = 0;
        Iterator<K> it = entries.keySet().iterator();
        while (it.hasNext()) {
            if (keyFilter.test(it.next())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public synchronized boolean containsKey(K key) {
        // containsKey does not touch access order
        return entries.containsKey(key);
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Keys from least to most recently used.
     */
    public synchronized List<K> keysByRecency() {
        return new ArrayList<>(entries.keySet());
    }
}
