package org.carball.sqlinspector.cache;

import lombok.extern.slf4j.Slf4j;
import org.carball.sqlinspector.exception.ResultNotFoundException;
import org.carball.sqlinspector.model.query.AggregationResult;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Keeps the aggregation results of the most recent requests so a later request
 * can show one group's executions without recomputing anything.
 *
 * <p>Eviction is first-in first-out: once the capacity is exceeded the entry
 * inserted earliest is dropped, however often it was read. Insertion and
 * eviction happen under one write lock, so readers never see a half-evicted
 * cache; lookups share a read lock.
 */
@Slf4j
public class QueryResultCache {

    private final int capacity;
    private final LinkedHashMap<String, AggregationResult> entries = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public QueryResultCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Generates a fresh, unguessable key for one inspection.
     */
    public static String newKey() {
        return UUID.randomUUID().toString();
    }

    /**
     * Stores a result. Storing under an existing key replaces it and makes it the newest entry.
     */
    public void put(String key, AggregationResult value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        lock.writeLock().lock();
        try {
            entries.remove(key);
            entries.put(key, value);

            Iterator<Map.Entry<String, AggregationResult>> oldestFirst = entries.entrySet().iterator();
            while (entries.size() > capacity && oldestFirst.hasNext()) {
                String evicted = oldestFirst.next().getKey();
                oldestFirst.remove();
                log.debug("Evicted inspection {} from result cache", evicted);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @throws ResultNotFoundException if nothing is stored under the key, including after eviction
     */
    public AggregationResult get(String key) {
        lock.readLock().lock();
        try {
            AggregationResult value = key == null ? null : entries.get(key);
            if (value == null) {
                throw new ResultNotFoundException("No inspection data for key " + key + "; it may have expired");
            }
            return value;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String key) {
        lock.readLock().lock();
        try {
            return key != null && entries.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Keys currently held, oldest first.
     */
    public List<String> keys() {
        lock.readLock().lock();
        try {
            return List.copyOf(entries.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }
}
