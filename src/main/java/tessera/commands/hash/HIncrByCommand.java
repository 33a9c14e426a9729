package tessera.commands.hash;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class HIncrByCommand extends HashCommand {
    public final Bytes field;
    public final long increment;

    public HIncrByCommand(Bytes key, Bytes field, long increment) {
        super(key);
        this.field = field;
        this.increment = increment;
    }

    @Override
    public String name() {
        return "HINCRBY";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.hincrby(this);
    }
}
