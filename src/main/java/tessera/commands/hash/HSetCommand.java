package tessera.commands.hash;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class HSetCommand extends HashCommand {
    public final Bytes field;
    public final Bytes value;

    public HSetCommand(Bytes key, Bytes field, Bytes value) {
        super(key);
        this.field = field;
        this.value = value;
    }

    @Override
    public String name() {
        return "HSET";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.hset(this);
    }
}
