package tessera.engine;

import tessera.commands.server.KeysCommand;
import tessera.commands.server.PingCommand;
import tessera.commands.server.ServerCommand;
import tessera.db.Bytes;
import tessera.db.LockedStore;
import tessera.db.StoreContext;
import tessera.utils.GlobPattern;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class ServerEngine implements ServerCommand.Handler {
    private final StoreContext context;

    public ServerEngine(StoreContext context) {
        this.context = context;
    }

    public Reply interact(ServerCommand command) {
        return command.accept(this);
    }

    @Override
    public Reply ping(PingCommand c) {
        return c.message == null ? Reply.status("PONG") : Reply.value(c.message);
    }

    /**
     * Keys of every container. Each container is read-locked on its own, one after the other,
     * so the result is not a single snapshot across types.
     */
    @Override
    public Reply keys(KeysCommand c) {
        GlobPattern glob = c.pattern == null ? null : GlobPattern.compile(c.pattern.toLatin1());
        Set<Bytes> out = new LinkedHashSet<>();
        List<LockedStore<?>> stores = Arrays.asList(context.strings(), context.hashes(), context.sets(), context.lists());
        for (LockedStore<?> store : stores) {
            for (Bytes key : store.keys()) {
                if (glob == null || glob.matches(key.toLatin1())) {
                    out.add(key);
                }
            }
        }
        return Reply.values(out);
    }
}
