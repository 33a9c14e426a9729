package tessera.commands.list;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class LPopCommand extends ListCommand {
    public final Bytes key;

    public LPopCommand(Bytes key) {
        this.key = key;
    }

    @Override
    public String name() {
        return "LPOP";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.lpop(this);
    }
}
