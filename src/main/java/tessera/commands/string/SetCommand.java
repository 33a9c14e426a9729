package tessera.commands.string;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class SetCommand extends StringCommand {
    public final Bytes key;
    public final Bytes value;

    public SetCommand(Bytes key, Bytes value) {
        this.key = key;
        this.value = value;
    }

    @Override
    public String name() {
        return "SET";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.set(this);
    }
}
