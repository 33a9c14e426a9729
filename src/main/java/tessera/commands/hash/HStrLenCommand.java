package tessera.commands.hash;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class HStrLenCommand extends HashCommand {
    public final Bytes field;

    public HStrLenCommand(Bytes key, Bytes field) {
        super(key);
        this.field = field;
    }

    @Override
    public String name() {
        return "HSTRLEN";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.hstrlen(this);
    }
}
