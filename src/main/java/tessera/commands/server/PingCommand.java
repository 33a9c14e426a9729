package tessera.commands.server;

import tessera.db.Bytes;
import tessera.engine.Reply;

/**
 * PING [message]. {@code message} is null for a bare PING.
 */
public class PingCommand extends ServerCommand {
    public final Bytes message;

    public PingCommand(Bytes message) {
        this.message = message;
    }

    @Override
    public String name() {
        return "PING";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.ping(this);
    }
}
