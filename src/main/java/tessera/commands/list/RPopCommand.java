package tessera.commands.list;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class RPopCommand extends ListCommand {
    public final Bytes key;

    public RPopCommand(Bytes key) {
        this.key = key;
    }

    @Override
    public String name() {
        return "RPOP";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.rpop(this);
    }
}
