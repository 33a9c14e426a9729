package tessera.commands.string;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class GetCommand extends StringCommand {
    public final Bytes key;

    public GetCommand(Bytes key) {
        this.key = key;
    }

    @Override
    public String name() {
        return "GET";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.get(this);
    }
}
