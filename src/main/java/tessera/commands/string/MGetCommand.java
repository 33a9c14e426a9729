package tessera.commands.string;

import tessera.db.Bytes;
import tessera.engine.Reply;

import java.util.List;

public class MGetCommand extends StringCommand {
    public final List<Bytes> keys;

    public MGetCommand(List<Bytes> keys) {
        this.keys = List.copyOf(keys);
    }

    @Override
    public String name() {
        return "MGET";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.mget(this);
    }
}
