package tessera.commands.list;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class LPushXCommand extends ListCommand {
    public final Bytes key;
    public final Bytes value;

    public LPushXCommand(Bytes key, Bytes value) {
        this.key = key;
        this.value = value;
    }

    @Override
    public String name() {
        return "LPUSHX";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.lpushx(this);
    }
}
