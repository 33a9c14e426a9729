package tessera.commands.set;

import tessera.db.Bytes;
import tessera.engine.Reply;

import java.util.List;

/**
 * SDIFFSTORE destination key [key ...]
 */
public class SDiffStoreCommand extends SetTypeCommand {
    public final Bytes destination;
    public final List<Bytes> keys;

    public SDiffStoreCommand(Bytes destination, List<Bytes> keys) {
        this.destination = destination;
        this.keys = List.copyOf(keys);
    }

    @Override
    public String name() {
        return "SDIFFSTORE";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.sdiffstore(this);
    }
}
