package tessera.commands.list;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class LIndexCommand extends ListCommand {
    public final Bytes key;
    public final long index;

    public LIndexCommand(Bytes key, long index) {
        this.key = key;
        this.index = index;
    }

    @Override
    public String name() {
        return "LINDEX";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.lindex(this);
    }
}
