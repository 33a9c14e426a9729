package tessera.commands.string;

import tessera.commands.Command;
import tessera.engine.Engine;
import tessera.engine.Reply;

public abstract class StringCommand implements Command {

    @Override
    public final Reply execute(Engine engine) {
        return engine.strings().interact(this);
    }

    public abstract Reply accept(Handler handler);

    public interface Handler {
        Reply set(SetCommand command);
        Reply get(GetCommand command);
        Reply del(DelCommand command);
        Reply rename(RenameCommand command);
        Reply exists(ExistsCommand command);
        Reply setnx(SetNxCommand command);
        Reply mget(MGetCommand command);
        Reply strlen(StrLenCommand command);
        Reply incrby(IncrByCommand command);
    }
}
