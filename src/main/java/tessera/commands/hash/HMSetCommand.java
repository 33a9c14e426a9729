package tessera.commands.hash;

import tessera.db.Bytes;
import tessera.engine.Reply;

import java.util.List;
import java.util.Map;

/**
 * HMSET key field value [field value ...]. Pairs are applied in order, so a repeated field keeps its last value.
 */
public class HMSetCommand extends HashCommand {
    public final List<Map.Entry<Bytes, Bytes>> pairs;

    public HMSetCommand(Bytes key, List<Map.Entry<Bytes, Bytes>> pairs) {
        super(key);
        this.pairs = List.copyOf(pairs);
    }

    @Override
    public String name() {
        return "HMSET";
    }

    @Override
    public Reply accept(Handler handler) {
        return handler.hmset(this);
    }
}
