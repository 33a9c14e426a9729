package tessera.commands.string;

import tessera.db.Bytes;
import tessera.engine.Reply;

import java.util.List;

/**
 * EXISTS key [key ...]. A key named twice counts twice.
 */
public class ExistsCommand extends StringCommand {
    public final List<Bytes> keys;

    public ExistsCommand(List<Bytes> keys) {
        this.keys = List.copyOf(keys);
    }

    @Override
    public String name() {
        return "EXISTS";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.exists(this);
    }
}
