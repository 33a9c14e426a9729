package tessera.engine;

import tessera.commands.list.*;
import tessera.db.Bytes;
import tessera.db.LockedStore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

public class ListEngine implements ListCommand.Handler {
    private final LockedStore<Deque<Bytes>> lists;

    public ListEngine(LockedStore<Deque<Bytes>> lists) {
        this.lists = lists;
    }

    public Reply interact(ListCommand command) {
        return command.accept(this);
    }

    @Override
    public Reply lpush(LPushCommand c) {
        return lists.write(store -> {
            Deque<Bytes> list = store.computeIfAbsent(c.key, k -> new ArrayDeque<>());
            for (Bytes value : c.values) {
                list.addFirst(value);
            }
            return Reply.integer(list.size());
        });
    }

    @Override
    public Reply rpush(RPushCommand c) {
        return lists.write(store -> {
            Deque<Bytes> list = store.computeIfAbsent(c.key, k -> new ArrayDeque<>());
            list.addAll(c.values);
            return Reply.integer(list.size());
        });
    }

    @Override
    public Reply lpushx(LPushXCommand c) {
        return lists.write(store -> {
            Deque<Bytes> list = store.get(c.key);
            if (list == null) return Reply.integer(0);
            list.addFirst(c.value);
            return Reply.integer(list.size());
        });
    }

    @Override
    public Reply rpushx(RPushXCommand c) {
        return lists.write(store -> {
            Deque<Bytes> list = store.get(c.key);
            if (list == null) return Reply.integer(0);
            list.addLast(c.value);
            return Reply.integer(list.size());
        });
    }

    @Override
    public Reply llen(LLenCommand c) {
        return lists.read(store -> {
            Deque<Bytes> list = store.get(c.key);
            return Reply.integer(list == null ? 0 : list.size());
        });
    }

    @Override
    public Reply lpop(LPopCommand c) {
        return lists.write(store -> {
            Deque<Bytes> list = store.get(c.key);
            return Reply.valueOrNil(list == null ? null : list.pollFirst());
        });
    }

    @Override
    public Reply rpop(RPopCommand c) {
        return lists.write(store -> {
            Deque<Bytes> list = store.get(c.key);
            return Reply.valueOrNil(list == null ? null : list.pollLast());
        });
    }

    @Override
    public Reply lrange(LRangeCommand c) {
        return lists.read(store -> {
            Deque<Bytes> list = store.get(c.key);
            List<Bytes> out = new ArrayList<>();
            if (list == null || list.isEmpty()) return Reply.values(out);

            int size = list.size();
            long start = c.start < 0 ? Math.max(0, size + c.start) : c.start;
            long stop = c.stop < 0 ? size + c.stop : Math.min(c.stop, size - 1);
            if (start > stop) return Reply.values(out);

            int i = 0;
            for (Iterator<Bytes> it = list.iterator(); it.hasNext() && i <= stop; i++) {
                Bytes value = it.next();
                if (i >= start) out.add(value);
            }
            return Reply.values(out);
        });
    }

    @Override
    public Reply lindex(LIndexCommand c) {
        return lists.read(store -> {
            Deque<Bytes> list = store.get(c.key);
            if (list == null) return Reply.nil();
            long index = c.index < 0 ? list.size() + c.index : c.index;
            if (index < 0 || index >= list.size()) return Reply.nil();
            return Reply.value(elementAt(list, (int) index));
        });
    }

    private static Bytes elementAt(Deque<Bytes> list, int index) {
        Iterator<Bytes> it = index < list.size() / 2 ? list.iterator() : list.descendingIterator();
        int steps = index < list.size() / 2 ? index : list.size() - 1 - index;
        Bytes value = it.next();
        for (int i = 0; i < steps; i++) {
            value = it.next();
        }
        return value;
    }
}
