package tessera.commands.hash;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class HLenCommand extends HashCommand {
    public HLenCommand(Bytes key) {
        super(key);
    }

    @Override
    public String name() {
        return "HLEN";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.hlen(this);
    }
}
