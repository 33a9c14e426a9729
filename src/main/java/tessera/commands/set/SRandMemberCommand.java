package tessera.commands.set;

import tessera.db.Bytes;
import tessera.engine.Reply;

/**
 * SRANDMEMBER key [count]. A negative count allows repeated members, and the reply then has
 * exactly {@code -count} entries, so its magnitude is capped at {@link #MAX_REPEATED_PICKS}.
 */
public class SRandMemberCommand extends SetTypeCommand {
    public static final int MAX_REPEATED_PICKS = 1_000_000;

    public final Bytes key;
    public final Long count;

    public SRandMemberCommand(Bytes key, Long count) {
        this.key = key;
        this.count = count;
    }

    @Override
    public String name() {
        return "SRANDMEMBER";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.srandmember(this);
    }
}
