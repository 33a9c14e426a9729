package tessera.commands.set;

import tessera.db.Bytes;
import tessera.engine.Reply;

import java.util.List;

public class SInterCommand extends SetTypeCommand {
    public final List<Bytes> keys;

    public SInterCommand(List<Bytes> keys) {
        this.keys = List.copyOf(keys);
    }

    @Override
    public String name() {
        return "SINTER";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.sinter(this);
    }
}
