package tessera.commands.list;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class RPushXCommand extends ListCommand {
    public final Bytes key;
    public final Bytes value;

    public RPushXCommand(Bytes key, Bytes value) {
        this.key = key;
        this.value = value;
    }

    @Override
    public String name() {
        return "RPUSHX";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.rpushx(this);
    }
}
