package tessera.commands.hash;

import tessera.db.Bytes;
import tessera.engine.Reply;

/**
 * HGET key field
 */
public class HGetCommand extends HashCommand {
    public final Bytes field;

    public HGetCommand(Bytes key, Bytes field) {
        super(key);
        this.field = field;
    }

    @Override
    public String name() {
        return "HGET";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.hget(this);
    }
}
