package tessera.engine;

import tessera.commands.set.*;
import tessera.db.Bytes;
import tessera.db.LockedStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Executes set commands. The *STORE variants and SMOVE work on two or more keys of the same
 * container, so one exclusive lock acquisition covers them; nothing is written unless the
 * whole command succeeds.
 */
public class SetEngine implements SetTypeCommand.Handler {
    private final LockedStore<Set<Bytes>> sets;

    public SetEngine(LockedStore<Set<Bytes>> sets) {
        this.sets = sets;
    }

    public Reply interact(SetTypeCommand command) {
        return command.accept(this);
    }

    private static Set<Bytes> setOf(Map<Bytes, Set<Bytes>> store, Bytes key) {
        Set<Bytes> set = store.get(key);
        return set != null ? set : Collections.emptySet();
    }

    @Override
    public Reply sadd(SAddCommand c) {
        return sets.write(store -> {
            Set<Bytes> set = store.computeIfAbsent(c.key, k -> new HashSet<>());
            int added = 0;
            for (Bytes member : c.members) {
                if (set.add(member)) added++;
            }
            return Reply.integer(added);
        });
    }

    @Override
    public Reply srem(SRemCommand c) {
        return sets.write(store -> {
            Set<Bytes> set = store.get(c.key);
            if (set == null) return Reply.integer(0);
            int removed = 0;
            for (Bytes member : c.members) {
                if (set.remove(member)) removed++;
            }
            return Reply.integer(removed);
        });
    }

    @Override
    public Reply smembers(SMembersCommand c) {
        return sets.read(store -> Reply.values(setOf(store, c.key)));
    }

    @Override
    public Reply scard(SCardCommand c) {
        return sets.read(store -> Reply.integer(setOf(store, c.key).size()));
    }

    @Override
    public Reply sismember(SIsMemberCommand c) {
        return sets.read(store -> Reply.integer(setOf(store, c.key).contains(c.member) ? 1 : 0));
    }

    @Override
    public Reply sdiff(SDiffCommand c) {
        return sets.read(store -> Reply.values(diff(store, c.keys)));
    }

    @Override
    public Reply sunion(SUnionCommand c) {
        return sets.read(store -> Reply.values(union(store, c.keys)));
    }

    @Override
    public Reply sinter(SInterCommand c) {
        return sets.read(store -> Reply.values(inter(store, c.keys)));
    }

    @Override
    public Reply sdiffstore(SDiffStoreCommand c) {
        return sets.write(store -> store(store, c.destination, diff(store, c.keys)));
    }

    @Override
    public Reply sunionstore(SUnionStoreCommand c) {
        return sets.write(store -> store(store, c.destination, union(store, c.keys)));
    }

    @Override
    public Reply sinterstore(SInterStoreCommand c) {
        return sets.write(store -> store(store, c.destination, inter(store, c.keys)));
    }

    @Override
    public Reply spop(SPopCommand c) {
        return sets.write(store -> {
            Set<Bytes> set = store.get(c.key);
            int wanted = c.count == null ? 1 : (int) Math.min(c.count, Integer.MAX_VALUE);
            List<Bytes> popped = set == null ? Collections.emptyList() : pickDistinct(set, wanted);
            if (set != null) set.removeAll(popped);
            if (c.count == null) {
                return popped.isEmpty() ? Reply.nil() : Reply.value(popped.get(0));
            }
            return Reply.values(popped);
        });
    }

    @Override
    public Reply smove(SMoveCommand c) {
        return sets.write(store -> {
            Set<Bytes> source = store.get(c.source);
            if (source == null || !source.remove(c.member)) {
                return Reply.integer(0);
            }
            store.computeIfAbsent(c.destination, k -> new HashSet<>()).add(c.member);
            return Reply.integer(1);
        });
    }

    @Override
    public Reply srandmember(SRandMemberCommand c) {
        return sets.read(store -> {
            Set<Bytes> set = setOf(store, c.key);
            if (c.count == null) {
                List<Bytes> picked = pickDistinct(set, 1);
                return picked.isEmpty() ? Reply.nil() : Reply.value(picked.get(0));
            }
            if (c.count >= 0) {
                return Reply.values(pickDistinct(set, (int) (long) c.count));
            }
            // Negative count: exactly -count picks, repeats allowed.
            if (set.isEmpty()) return Reply.values(Collections.emptyList());
            List<Bytes> members = new ArrayList<>(set);
            int picks = (int) -c.count;
            List<Bytes> out = new ArrayList<>(Math.min(picks, 1024));
            ThreadLocalRandom random = ThreadLocalRandom.current();
            for (int i = 0; i < picks; i++) {
                out.add(members.get(random.nextInt(members.size())));
            }
            return Reply.values(out);
        });
    }

    private static Reply store(Map<Bytes, Set<Bytes>> store, Bytes destination, Set<Bytes> result) {
        store.put(destination, new HashSet<>(result));
        return Reply.integer(result.size());
    }

    private static Set<Bytes> diff(Map<Bytes, Set<Bytes>> store, List<Bytes> keys) {
        Set<Bytes> result = new LinkedHashSet<>(setOf(store, keys.get(0)));
        for (int i = 1; i < keys.size() && !result.isEmpty(); i++) {
            result.removeAll(setOf(store, keys.get(i)));
        }
        return result;
    }

    private static Set<Bytes> union(Map<Bytes, Set<Bytes>> store, List<Bytes> keys) {
        Set<Bytes> result = new LinkedHashSet<>();
        for (Bytes key : keys) {
            result.addAll(setOf(store, key));
        }
        return result;
    }

    private static Set<Bytes> inter(Map<Bytes, Set<Bytes>> store, List<Bytes> keys) {
        Set<Bytes> result = new LinkedHashSet<>(setOf(store, keys.get(0)));
        for (int i = 1; i < keys.size() && !result.isEmpty(); i++) {
            result.retainAll(setOf(store, keys.get(i)));
        }
        return result;
    }

    /**
     * Up to {@code count} distinct members in random order (partial Fisher-Yates).
     */
    private static List<Bytes> pickDistinct(Set<Bytes> set, int count) {
        Bytes[] arr = set.toArray(new Bytes[0]);
        int todo = Math.min(count, arr.length);
        ThreadLocalRandom random = ThreadLocalRandom.current();
        List<Bytes> picked = new ArrayList<>(todo);
        for (int i = 0; i < todo; i++) {
            int idx = random.nextInt(arr.length - i);
            picked.add(arr[idx]);
            // Move last available to this spot so we don't pick it again
            arr[idx] = arr[arr.length - 1 - i];
        }
        return picked;
    }
}
