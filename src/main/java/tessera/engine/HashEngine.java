package tessera.engine;

import tessera.commands.hash.*;
import tessera.db.Bytes;
import tessera.db.LockedStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes hash commands against the hash container.
 *
 * <p>Reads take the container's shared lock, writes its exclusive lock. An absent key reads
 * as an empty hash. Writes create the hash on first touch, and a hash emptied by HDEL stays
 * attached to its key.
 */
public class HashEngine implements HashCommand.Handler {
    private final LockedStore<Map<Bytes, Bytes>> hashes;

    public HashEngine(LockedStore<Map<Bytes, Bytes>> hashes) {
        this.hashes = hashes;
    }

    public Reply interact(HashCommand command) {
        return command.accept(this);
    }

    private static Map<Bytes, Bytes> hashOf(Map<Bytes, Map<Bytes, Bytes>> store, Bytes key) {
        Map<Bytes, Bytes> hash = store.get(key);
        return hash != null ? hash : Collections.emptyMap();
    }

    @Override
    public Reply hget(HGetCommand c) {
        return hashes.read(store -> Reply.valueOrNil(hashOf(store, c.key).get(c.field)));
    }

    @Override
    public Reply hset(HSetCommand c) {
        return hashes.write(store -> {
            store.computeIfAbsent(c.key, k -> new HashMap<>()).put(c.field, c.value);
            return Reply.ok();
        });
    }

    @Override
    public Reply hexists(HExistsCommand c) {
        return hashes.read(store -> Reply.integer(hashOf(store, c.key).containsKey(c.field) ? 1 : 0));
    }

    @Override
    public Reply hgetall(HGetAllCommand c) {
        return hashes.read(store -> {
            Map<Bytes, Bytes> hash = hashOf(store, c.key);
            List<Bytes> flat = new ArrayList<>(hash.size() * 2);
            for (Map.Entry<Bytes, Bytes> e : hash.entrySet()) {
                flat.add(e.getKey());
                flat.add(e.getValue());
            }
            return Reply.values(flat);
        });
    }

    @Override
    public Reply hmget(HMGetCommand c) {
        return hashes.read(store -> {
            Map<Bytes, Bytes> hash = hashOf(store, c.key);
            List<Reply> out = new ArrayList<>(c.fields.size());
            for (Bytes field : c.fields) {
                out.add(Reply.valueOrNil(hash.get(field)));
            }
            return Reply.array(out);
        });
    }

    @Override
    public Reply hkeys(HKeysCommand c) {
        return hashes.read(store -> Reply.values(hashOf(store, c.key).keySet()));
    }

    @Override
    public Reply hmset(HMSetCommand c) {
        return hashes.write(store -> {
            Map<Bytes, Bytes> hash = store.computeIfAbsent(c.key, k -> new HashMap<>());
            for (Map.Entry<Bytes, Bytes> pair : c.pairs) {
                hash.put(pair.getKey(), pair.getValue());
            }
            return Reply.ok();
        });
    }

    @Override
    public Reply hincrby(HIncrByCommand c) {
        return hashes.write(store -> {
            long next;
            try {
                next = Counters.add(hashOf(store, c.key).get(c.field), c.increment);
            } catch (NumberFormatException e) {
                return Reply.error(Counters.BAD_TYPE);
            } catch (ArithmeticException e) {
                return Reply.error(Counters.OVERFLOW);
            }
            store.computeIfAbsent(c.key, k -> new HashMap<>()).put(c.field, Bytes.of(Long.toString(next)));
            return Reply.ok();
        });
    }

    @Override
    public Reply hlen(HLenCommand c) {
        return hashes.read(store -> Reply.integer(hashOf(store, c.key).size()));
    }

    @Override
    public Reply hdel(HDelCommand c) {
        return hashes.write(store -> {
            Map<Bytes, Bytes> hash = store.get(c.key);
            if (hash == null) return Reply.integer(0);
            int removed = 0;
            for (Bytes field : c.fields) {
                if (hash.remove(field) != null) removed++;
            }
            return Reply.integer(removed);
        });
    }

    @Override
    public Reply hvals(HValsCommand c) {
        return hashes.read(store -> Reply.values(hashOf(store, c.key).values()));
    }

    @Override
    public Reply hstrlen(HStrLenCommand c) {
        return hashes.read(store -> {
            Bytes value = hashOf(store, c.key).get(c.field);
            return Reply.integer(value == null ? 0 : value.length());
        });
    }

    @Override
    public Reply hsetnx(HSetNxCommand c) {
        return hashes.write(store -> {
            Map<Bytes, Bytes> hash = store.computeIfAbsent(c.key, k -> new HashMap<>());
            return Reply.integer(hash.putIfAbsent(c.field, c.value) == null ? 1 : 0);
        });
    }
}
