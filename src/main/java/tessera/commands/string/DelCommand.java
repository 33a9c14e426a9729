package tessera.commands.string;

import tessera.db.Bytes;
import tessera.engine.Reply;

import java.util.List;

/**
 * DEL key [key ...]
 */
public class DelCommand extends StringCommand {
    public final List<Bytes> keys;

    public DelCommand(List<Bytes> keys) {
        this.keys = List.copyOf(keys);
    }

    @Override
    public String name() {
        return "DEL";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.del(this);
    }
}
