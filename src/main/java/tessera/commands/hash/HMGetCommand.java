package tessera.commands.hash;

import tessera.db.Bytes;
import tessera.engine.Reply;

import java.util.List;

/**
 * HMGET key field [field ...]
 */
public class HMGetCommand extends HashCommand {
    public final List<Bytes> fields;

    public HMGetCommand(Bytes key, List<Bytes> fields) {
        super(key);
        this.fields = List.copyOf(fields);
    }

    @Override
    public String name() {
        return "HMGET";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.hmget(this);
    }
}
