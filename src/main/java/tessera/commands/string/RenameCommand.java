package tessera.commands.string;

import tessera.db.Bytes;
import tessera.engine.Reply;

/**
 * RENAME key newkey
 */
public class RenameCommand extends StringCommand {
    public final Bytes key;
    public final Bytes newKey;

    public RenameCommand(Bytes key, Bytes newKey) {
        this.key = key;
        this.newKey = newKey;
    }

    @Override
    public String name() {
        return "RENAME";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.rename(this);
    }
}
