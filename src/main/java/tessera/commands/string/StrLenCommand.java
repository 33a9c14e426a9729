package tessera.commands.string;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class StrLenCommand extends StringCommand {
    public final Bytes key;

    public StrLenCommand(Bytes key) {
        this.key = key;
    }

    @Override
    public String name() {
        return "STRLEN";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.strlen(this);
    }
}
