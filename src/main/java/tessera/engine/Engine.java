package tessera.engine;

import tessera.commands.Command;
import tessera.db.StoreContext;

/**
 * Entry point for executing commands: one sub-engine per data type over a shared {@link StoreContext}.
 * Thread-safe; any number of connections may call {@link #execute} concurrently.
 */
public class Engine {
    private final StringEngine strings;
    private final HashEngine hashes;
    private final SetEngine sets;
    private final ListEngine lists;
    private final ServerEngine server;

    public Engine(StoreContext context) {
        this.strings = new StringEngine(context.strings());
        this.hashes = new HashEngine(context.hashes());
        this.sets = new SetEngine(context.sets());
        this.lists = new ListEngine(context.lists());
        this.server = new ServerEngine(context);
    }

    public Reply execute(Command command) {
        return command.execute(this);
    }

    public StringEngine strings() {
        return strings;
    }

    public HashEngine hashes() {
        return hashes;
    }

    public SetEngine sets() {
        return sets;
    }

    public ListEngine lists() {
        return lists;
    }

    public ServerEngine server() {
        return server;
    }
}
