package tessera.db;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * One top-level container (key to per-type collection) guarded by a single read/write lock.
 * The lock covers the whole container, not individual keys.
 */
public class LockedStore<V> {
    private final Map<Bytes, V> map = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Runs {@code op} under the shared lock. The map handed to {@code op} rejects structural changes;
     * the collections it holds must not be mutated either.
     */
    public <R> R read(Function<Map<Bytes, V>, R> op) {
        lock.readLock().lock();
        try {
            return op.apply(Collections.unmodifiableMap(map));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Runs {@code op} under the exclusive lock. Nothing else reads or writes this container meanwhile. */
    public <R> R write(Function<Map<Bytes, V>, R> op) {
        lock.writeLock().lock();
        try {
            return op.apply(map);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        return read(Map::size);
    }

    public List<Bytes> keys() {
        return read(m -> new ArrayList<>(m.keySet()));
    }

    public boolean isWriteLocked() {
        return lock.isWriteLocked();
    }
}
