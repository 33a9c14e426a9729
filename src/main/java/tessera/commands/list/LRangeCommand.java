package tessera.commands.list;

import tessera.db.Bytes;
import tessera.engine.Reply;

/**
 * LRANGE key start stop, both ends inclusive
 */
public class LRangeCommand extends ListCommand {
    public final Bytes key;
    public final long start;
    public final long stop;

    public LRangeCommand(Bytes key, long start, long stop) {
        this.key = key;
        this.start = start;
        this.stop = stop;
    }

    @Override
    public String name() {
        return "LRANGE";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.lrange(this);
    }
}
