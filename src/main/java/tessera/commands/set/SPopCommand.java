package tessera.commands.set;

import tessera.db.Bytes;
import tessera.engine.Reply;

/**
 * SPOP key [count]. {@code count} is null when not given, which changes the reply shape.
 */
public class SPopCommand extends SetTypeCommand {
    public final Bytes key;
    public final Long count;

    public SPopCommand(Bytes key, Long count) {
        this.key = key;
        this.count = count;
    }

    @Override
    public String name() {
        return "SPOP";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.spop(this);
    }
}
