package tessera.commands.set;

import tessera.commands.Command;
import tessera.engine.Engine;
import tessera.engine.Reply;

/**
 * Commands against the set container. Multi-key commands (SDIFF, SMOVE, ...) still touch
 * only this one container.
 */
public abstract class SetTypeCommand implements Command {

    @Override
    public final Reply execute(Engine engine) {
        return engine.sets().interact(this);
    }

    public abstract Reply accept(Handler handler);

    public interface Handler {
        Reply sadd(SAddCommand command);
        Reply srem(SRemCommand command);
        Reply smembers(SMembersCommand command);
        Reply scard(SCardCommand command);
        Reply sismember(SIsMemberCommand command);
        Reply sdiff(SDiffCommand command);
        Reply sunion(SUnionCommand command);
        Reply sinter(SInterCommand command);
        Reply sdiffstore(SDiffStoreCommand command);
        Reply sunionstore(SUnionStoreCommand command);
        Reply sinterstore(SInterStoreCommand command);
        Reply spop(SPopCommand command);
        Reply smove(SMoveCommand command);
        Reply srandmember(SRandMemberCommand command);
    }
}
