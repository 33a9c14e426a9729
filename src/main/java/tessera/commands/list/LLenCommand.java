package tessera.commands.list;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class LLenCommand extends ListCommand {
    public final Bytes key;

    public LLenCommand(Bytes key) {
        this.key = key;
    }

    @Override
    public String name() {
        return "LLEN";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.llen(this);
    }
}
