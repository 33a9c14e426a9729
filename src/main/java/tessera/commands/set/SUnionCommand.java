package tessera.commands.set;

import tessera.db.Bytes;
import tessera.engine.Reply;

import java.util.List;

public class SUnionCommand extends SetTypeCommand {
    public final List<Bytes> keys;

    public SUnionCommand(List<Bytes> keys) {
        this.keys = List.copyOf(keys);
    }

    @Override
    public String name() {
        return "SUNION";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.sunion(this);
    }
}
