package tessera.commands.set;

import tessera.db.Bytes;
import tessera.engine.Reply;

import java.util.List;

/**
 * SADD key member [member ...]
 */
public class SAddCommand extends SetTypeCommand {
    public final Bytes key;
    public final List<Bytes> members;

    public SAddCommand(Bytes key, List<Bytes> members) {
        this.key = key;
        this.members = List.copyOf(members);
    }

    @Override
    public String name() {
        return "SADD";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.sadd(this);
    }
}
