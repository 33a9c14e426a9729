package tessera.commands.list;

import tessera.db.Bytes;
import tessera.engine.Reply;

import java.util.List;

/**
 * LPUSH key value [value ...]. Values are pushed one by one, so the last one ends up at the head.
 */
public class LPushCommand extends ListCommand {
    public final Bytes key;
    public final List<Bytes> values;

    public LPushCommand(Bytes key, List<Bytes> values) {
        this.key = key;
        this.values = List.copyOf(values);
    }

    @Override
    public String name() {
        return "LPUSH";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.lpush(this);
    }
}
