package tessera.commands.hash;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class HValsCommand extends HashCommand {
    public HValsCommand(Bytes key) {
        super(key);
    }

    @Override
    public String name() {
        return "HVALS";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.hvals(this);
    }
}
