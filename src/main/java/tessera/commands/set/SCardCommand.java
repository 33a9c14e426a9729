package tessera.commands.set;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class SCardCommand extends SetTypeCommand {
    public final Bytes key;

    public SCardCommand(Bytes key) {
        this.key = key;
    }

    @Override
    public String name() {
        return "SCARD";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.scard(this);
    }
}
