package tessera.commands.set;

import tessera.db.Bytes;
import tessera.engine.Reply;

import java.util.List;

/**
 * Members of the first set that are in none of the others.
 */
public class SDiffCommand extends SetTypeCommand {
    public final List<Bytes> keys;

    public SDiffCommand(List<Bytes> keys) {
        this.keys = List.copyOf(keys);
    }

    @Override
    public String name() {
        return "SDIFF";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.sdiff(this);
    }
}
