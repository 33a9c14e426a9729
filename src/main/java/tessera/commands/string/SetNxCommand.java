package tessera.commands.string;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class SetNxCommand extends StringCommand {
    public final Bytes key;
    public final Bytes value;

    public SetNxCommand(Bytes key, Bytes value) {
        this.key = key;
        this.value = value;
    }

    @Override
    public String name() {
        return "SETNX";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.setnx(this);
    }
}
