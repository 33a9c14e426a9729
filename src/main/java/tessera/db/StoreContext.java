package tessera.db;

import java.util.Deque;
import java.util.Map;
import java.util.Set;

/**
 * The four independent containers, one per data type. Engines receive this object
 * explicitly; there is no global instance.
 *
 * <p>No command holds two of these locks at once. If one ever has to, acquire them in
 * declaration order: strings, hashes, sets, lists.
 */
public class StoreContext {
    private final LockedStore<Bytes> strings = new LockedStore<>();
    private final LockedStore<Map<Bytes, Bytes>> hashes = new LockedStore<>();
    private final LockedStore<Set<Bytes>> sets = new LockedStore<>();
    private final LockedStore<Deque<Bytes>> lists = new LockedStore<>();

    public LockedStore<Bytes> strings() {
        return strings;
    }

    public LockedStore<Map<Bytes, Bytes>> hashes() {
        return hashes;
    }

    public LockedStore<Set<Bytes>> sets() {
        return sets;
    }

    public LockedStore<Deque<Bytes>> lists() {
        return lists;
    }

    /** Total top-level entries across all containers. A key present in two containers counts twice. */
    public int size() {
        return strings.size() + hashes.size() + sets.size() + lists.size();
    }
}
