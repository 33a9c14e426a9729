package tessera.commands.hash;

import tessera.commands.Command;
import tessera.db.Bytes;
import tessera.engine.Engine;
import tessera.engine.Reply;

/**
 * Commands against the hash container. Every hash command addresses exactly one top-level key.
 */
public abstract class HashCommand implements Command {
    public final Bytes key;

    protected HashCommand(Bytes key) {
        this.key = key;
    }

    @Override
    public final Reply execute(Engine engine) {
        return engine.hashes().interact(this);
    }

    public abstract Reply accept(Handler handler);

    /**
     * One method per hash command. Implementations cannot compile without handling all of them.
     */
    public interface Handler {
        Reply hget(HGetCommand command);
        Reply hset(HSetCommand command);
        Reply hexists(HExistsCommand command);
        Reply hgetall(HGetAllCommand command);
        Reply hmget(HMGetCommand command);
        Reply hkeys(HKeysCommand command);
        Reply hmset(HMSetCommand command);
        Reply hincrby(HIncrByCommand command);
        Reply hlen(HLenCommand command);
        Reply hdel(HDelCommand command);
        Reply hvals(HValsCommand command);
        Reply hstrlen(HStrLenCommand command);
        Reply hsetnx(HSetNxCommand command);
    }
}
