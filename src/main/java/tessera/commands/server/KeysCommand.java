package tessera.commands.server;

import tessera.db.Bytes;
import tessera.engine.Reply;

/**
 * KEYS [pattern]. {@code pattern} is null when every key is wanted.
 */
public class KeysCommand extends ServerCommand {
    public final Bytes pattern;

    public KeysCommand(Bytes pattern) {
        this.pattern = pattern;
    }

    @Override
    public String name() {
        return "KEYS";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.keys(this);
    }
}
