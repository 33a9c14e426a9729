package tessera.commands.hash;

import tessera.db.Bytes;
import tessera.engine.Reply;

/**
 * HSETNX key field value
 */
public class HSetNxCommand extends HashCommand {
    public final Bytes field;
    public final Bytes value;

    public HSetNxCommand(Bytes key, Bytes field, Bytes value) {
        super(key);
        this.field = field;
        this.value = value;
    }

    @Override
    public String name() {
        return "HSETNX";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.hsetnx(this);
    }
}
