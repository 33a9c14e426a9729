package tessera.commands.set;

import tessera.db.Bytes;
import tessera.engine.Reply;

public class SIsMemberCommand extends SetTypeCommand {
    public final Bytes key;
    public final Bytes member;

    public SIsMemberCommand(Bytes key, Bytes member) {
        this.key = key;
        this.member = member;
    }

    @Override
    public String name() {
        return "SISMEMBER";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.sismember(this);
    }
}
