package tessera.commands.set;

import tessera.db.Bytes;
import tessera.engine.Reply;

import java.util.List;

public class SInterStoreCommand extends SetTypeCommand {
    public final Bytes destination;
    public final List<Bytes> keys;

    public SInterStoreCommand(Bytes destination, List<Bytes> keys) {
        this.destination = destination;
        this.keys = List.copyOf(keys);
    }

    @Override
    public String name() {
        return "SINTERSTORE";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.sinterstore(this);
    }
}
