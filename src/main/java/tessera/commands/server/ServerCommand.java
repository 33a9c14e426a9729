package tessera.commands.server;

import tessera.commands.Command;
import tessera.engine.Engine;
import tessera.engine.Reply;

// Commands that are not bound to one data type.
public abstract class ServerCommand implements Command {

    @Override
    public final Reply execute(Engine engine) {
        return engine.server().interact(this);
    }

    public abstract Reply accept(Handler handler);

    public interface Handler {
        Reply ping(PingCommand command);
        Reply keys(KeysCommand command);
    }
}
