package tessera.commands.list;

import tessera.commands.Command;
import tessera.engine.Engine;
import tessera.engine.Reply;

public abstract class ListCommand implements Command {

    @Override
    public final Reply execute(Engine engine) {
        return engine.lists().interact(this);
    }

    public abstract Reply accept(Handler handler);

    public interface Handler {
        Reply lpush(LPushCommand command);
        Reply rpush(RPushCommand command);
        Reply lpushx(LPushXCommand command);
        Reply rpushx(RPushXCommand command);
        Reply llen(LLenCommand command);
        Reply lpop(LPopCommand command);
        Reply rpop(RPopCommand command);
        Reply lrange(LRangeCommand command);
        Reply lindex(LIndexCommand command);
    }
}
