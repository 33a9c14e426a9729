package tessera.commands.hash;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class HKeysCommand extends HashCommand {
    public HKeysCommand(Bytes key) {
        super(key);
    }

    @Override
    public String name() {
        return "HKEYS";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.hkeys(this);
    }
}
