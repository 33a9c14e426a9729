package tessera.commands.set;

import tessera.db.Bytes;
import tessera.engine.Reply;

import java.util.List;

public class SRemCommand extends SetTypeCommand {
    public final Bytes key;
    public final List<Bytes> members;

    public SRemCommand(Bytes key, List<Bytes> members) {
        this.key = key;
        this.members = List.copyOf(members);
    }

    @Override
    public String name() {
        return "SREM";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.srem(this);
    }
}
