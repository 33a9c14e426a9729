package tessera.commands.hash;

import tessera.db.Bytes;
import tessera.engine.Reply;

import java.util.List;

/**
 * HDEL key field [field ...]
 */
public class HDelCommand extends HashCommand {
    public final List<Bytes> fields;

    public HDelCommand(Bytes key, List<Bytes> fields) {
        super(key);
        this.fields = List.copyOf(fields);
    }

    @Override
    public String name() {
        return "HDEL";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.hdel(this);
    }
}
