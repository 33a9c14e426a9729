package tessera.commands.set;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class SMembersCommand extends SetTypeCommand {
    public final Bytes key;

    public SMembersCommand(Bytes key) {
        this.key = key;
    }

    @Override
    public String name() {
        return "SMEMBERS";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.smembers(this);
    }
}
