package tessera.commands.set;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class SMoveCommand extends SetTypeCommand {
    public final Bytes source;
    public final Bytes destination;
    public final Bytes member;

    public SMoveCommand(Bytes source, Bytes destination, Bytes member) {
        this.source = source;
        this.destination = destination;
        this.member = member;
    }

    @Override
    public String name() {
        return "SMOVE";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.smove(this);
    }
}
