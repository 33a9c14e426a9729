package tessera.commands.hash;

import tessera.db.Bytes;
import tessera.engine.Reply;

/**
 * HGETALL key
 */
public class HGetAllCommand extends HashCommand {
    public HGetAllCommand(Bytes key) {
        super(key);
    }

    @Override
    public String name() {
        return "HGETALL";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.hgetall(this);
    }
}
