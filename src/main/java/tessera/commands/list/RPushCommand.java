package tessera.commands.list;

import tessera.db.Bytes;
import tessera.engine.Reply;

import java.util.List;

public class RPushCommand extends ListCommand {
    public final Bytes key;
    public final List<Bytes> values;

    public RPushCommand(Bytes key, List<Bytes> values) {
        this.key = key;
        this.values = List.copyOf(values);
    }

    @Override
    public String name() {
        return "RPUSH";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.rpush(this);
    }
}
