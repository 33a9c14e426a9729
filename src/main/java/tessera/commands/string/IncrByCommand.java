package tessera.commands.string;

import tessera.db.Bytes;
import tessera.engine.Reply;

/**
 * INCR, DECR, INCRBY and DECRBY all translate to this command; DECR/DECRBY carry a negated delta.
 */
public class IncrByCommand extends StringCommand {
    public final Bytes key;
    public final long delta;

    public IncrByCommand(Bytes key, long delta) {
        this.key = key;
        this.delta = delta;
    }

    @Override
    public String name() {
        return "INCRBY";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.incrby(this);
    }
}
