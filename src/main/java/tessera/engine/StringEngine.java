package tessera.engine;

import tessera.commands.string.*;
import tessera.db.Bytes;
import tessera.db.LockedStore;

import java.util.ArrayList;
import java.util.List;

/**
 * Executes string (plain key/value) commands. DEL, EXISTS and RENAME only see this container.
 */
public class StringEngine implements StringCommand.Handler {
    static final String NO_SUCH_KEY = "ERR no such key";

    private final LockedStore<Bytes> strings;

    public StringEngine(LockedStore<Bytes> strings) {
        this.strings = strings;
    }

    public Reply interact(StringCommand command) {
        return command.accept(this);
    }

    @Override
    public Reply set(SetCommand c) {
        return strings.write(store -> {
            store.put(c.key, c.value);
            return Reply.ok();
        });
    }

    @Override
    public Reply get(GetCommand c) {
        return strings.read(store -> Reply.valueOrNil(store.get(c.key)));
    }

    @Override
    public Reply del(DelCommand c) {
        return strings.write(store -> {
            int removed = 0;
            for (Bytes key : c.keys) {
                if (store.remove(key) != null) removed++;
            }
            return Reply.integer(removed);
        });
    }

    @Override
    public Reply rename(RenameCommand c) {
        return strings.write(store -> {
            Bytes value = store.get(c.key);
            if (value == null) {
                return Reply.error(NO_SUCH_KEY);
            }
            store.remove(c.key);
            store.put(c.newKey, value);
            return Reply.ok();
        });
    }

    @Override
    public Reply exists(ExistsCommand c) {
        return strings.read(store -> {
            int found = 0;
            for (Bytes key : c.keys) {
                if (store.containsKey(key)) found++;
            }
            return Reply.integer(found);
        });
    }

    @Override
    public Reply setnx(SetNxCommand c) {
        return strings.write(store -> Reply.integer(store.putIfAbsent(c.key, c.value) == null ? 1 : 0));
    }

    @Override
    public Reply mget(MGetCommand c) {
        return strings.read(store -> {
            List<Reply> out = new ArrayList<>(c.keys.size());
            for (Bytes key : c.keys) {
                out.add(Reply.valueOrNil(store.get(key)));
            }
            return Reply.array(out);
        });
    }

    @Override
    public Reply strlen(StrLenCommand c) {
        return strings.read(store -> {
            Bytes value = store.get(c.key);
            return Reply.integer(value == null ? 0 : value.length());
        });
    }

    @Override
    public Reply incrby(IncrByCommand c) {
        return strings.write(store -> {
            long next;
            try {
                next = Counters.add(store.get(c.key), c.delta);
            } catch (NumberFormatException e) {
                return Reply.error(Counters.BAD_TYPE);
            } catch (ArithmeticException e) {
                return Reply.error(Counters.OVERFLOW);
            }
            store.put(c.key, Bytes.of(Long.toString(next)));
            return Reply.integer(next);
        });
    }
}
