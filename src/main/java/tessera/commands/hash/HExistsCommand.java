package tessera.commands.hash;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class HExistsCommand extends HashCommand {
    public final Bytes field;

    public HExistsCommand(Bytes key, Bytes field) {
        super(key);
        this.field = field;
    }

    @Override
    public String name() {
        return "HEXISTS";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.hexists(this);
    }
}
