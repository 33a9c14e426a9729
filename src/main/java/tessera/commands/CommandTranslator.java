package tessera.commands;

import tessera.commands.hash.*;
import tessera.commands.list.*;
import tessera.commands.server.*;
import tessera.commands.set.*;
import tessera.commands.string.*;
import tessera.db.Bytes;
import tessera.protocol.RedisValue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns a decoded wire value into a typed {@link Command}. Pure: no store is touched here.
 *
 * <p>A bare simple or bulk string may only name a zero-argument command (PING, KEYS).
 * An array names the command in its first element; the rest are checked by the
 * command's parser. Arity always counts the arguments after the name.
 */
public final class CommandTranslator {

    @FunctionalInterface
    interface CommandParser {
        Command parse(Arguments args) throws TranslationException;
    }

    private static final Map<String, CommandParser> parsers = new HashMap<>();

    static {
        // Server
        register("ping", args -> {
            args.atMost(1);
            return new PingCommand(args.optionalBytes(0));
        });
        register("keys", args -> {
            args.atMost(1);
            return new KeysCommand(args.optionalBytes(0));
        });

        // String
        register("set", args -> {
            args.exact(2);
            return new SetCommand(args.bytes(0), args.bytes(1));
        });
        register("get", args -> {
            args.exact(1);
            return new GetCommand(args.bytes(0));
        });
        register("del", args -> {
            args.atLeast(1);
            return new DelCommand(args.bytesFrom(0));
        });
        register("rename", args -> {
            args.exact(2);
            return new RenameCommand(args.bytes(0), args.bytes(1));
        });
        register("exists", args -> {
            args.atLeast(1);
            return new ExistsCommand(args.bytesFrom(0));
        });
        register("setnx", args -> {
            args.exact(2);
            return new SetNxCommand(args.bytes(0), args.bytes(1));
        });
        register("mget", args -> {
            args.atLeast(1);
            return new MGetCommand(args.bytesFrom(0));
        });
        register("strlen", args -> {
            args.exact(1);
            return new StrLenCommand(args.bytes(0));
        });
        register("incr", args -> {
            args.exact(1);
            return new IncrByCommand(args.bytes(0), 1);
        });
        register("decr", args -> {
            args.exact(1);
            return new IncrByCommand(args.bytes(0), -1);
        });
        register("incrby", args -> {
            args.exact(2);
            return new IncrByCommand(args.bytes(0), args.count(1));
        });
        register("decrby", args -> {
            args.exact(2);
            long delta = args.count(1);
            if (delta == Long.MIN_VALUE) {
                // cannot be negated
                throw TranslationException.invalidType();
            }
            return new IncrByCommand(args.bytes(0), -delta);
        });

        // Hash
        register("hget", args -> {
            args.exact(2);
            return new HGetCommand(args.bytes(0), args.bytes(1));
        });
        register("hset", args -> {
            args.exact(3);
            return new HSetCommand(args.bytes(0), args.bytes(1), args.bytes(2));
        });
        register("hexists", args -> {
            args.exact(2);
            return new HExistsCommand(args.bytes(0), args.bytes(1));
        });
        register("hgetall", args -> {
            args.exact(1);
            return new HGetAllCommand(args.bytes(0));
        });
        register("hmget", args -> {
            args.atLeast(2);
            return new HMGetCommand(args.bytes(0), args.bytesFrom(1));
        });
        register("hkeys", args -> {
            args.exact(1);
            return new HKeysCommand(args.bytes(0));
        });
        register("hmset", args -> {
            args.atLeast(3);
            if ((args.size() - 1) % 2 != 0) {
                throw TranslationException.syntaxError();
            }
            List<Bytes> flat = args.bytesFrom(1);
            List<Map.Entry<Bytes, Bytes>> pairs = new ArrayList<>(flat.size() / 2);
            for (int i = 0; i < flat.size(); i += 2) {
                pairs.add(Map.entry(flat.get(i), flat.get(i + 1)));
            }
            return new HMSetCommand(args.bytes(0), pairs);
        });
        register("hincrby", args -> {
            args.exact(3);
            return new HIncrByCommand(args.bytes(0), args.bytes(1), args.count(2));
        });
        register("hlen", args -> {
            args.exact(1);
            return new HLenCommand(args.bytes(0));
        });
        register("hdel", args -> {
            args.atLeast(2);
            return new HDelCommand(args.bytes(0), args.bytesFrom(1));
        });
        register("hvals", args -> {
            args.exact(1);
            return new HValsCommand(args.bytes(0));
        });
        register("hstrlen", args -> {
            args.exact(2);
            return new HStrLenCommand(args.bytes(0), args.bytes(1));
        });
        register("hsetnx", args -> {
            args.exact(3);
            return new HSetNxCommand(args.bytes(0), args.bytes(1), args.bytes(2));
        });

        // Set
        register("sadd", args -> {
            args.atLeast(2);
            return new SAddCommand(args.bytes(0), args.bytesFrom(1));
        });
        register("srem", args -> {
            args.atLeast(2);
            return new SRemCommand(args.bytes(0), args.bytesFrom(1));
        });
        register("smembers", args -> {
            args.exact(1);
            return new SMembersCommand(args.bytes(0));
        });
        register("scard", args -> {
            args.exact(1);
            return new SCardCommand(args.bytes(0));
        });
        register("sismember", args -> {
            args.exact(2);
            return new SIsMemberCommand(args.bytes(0), args.bytes(1));
        });
        register("sdiff", args -> {
            args.atLeast(2);
            return new SDiffCommand(args.bytesFrom(0));
        });
        register("sunion", args -> {
            args.atLeast(2);
            return new SUnionCommand(args.bytesFrom(0));
        });
        register("sinter", args -> {
            args.atLeast(2);
            return new SInterCommand(args.bytesFrom(0));
        });
        register("sdiffstore", args -> {
            args.atLeast(2);
            return new SDiffStoreCommand(args.bytes(0), args.bytesFrom(1));
        });
        register("sunionstore", args -> {
            args.atLeast(2);
            return new SUnionStoreCommand(args.bytes(0), args.bytesFrom(1));
        });
        register("sinterstore", args -> {
            args.atLeast(2);
            return new SInterStoreCommand(args.bytes(0), args.bytesFrom(1));
        });
        register("spop", args -> {
            args.atLeast(1);
            args.atMost(2);
            Long count = args.optionalCount(1);
            if (count != null && count < 0) {
                throw TranslationException.invalidType();
            }
            return new SPopCommand(args.bytes(0), count);
        });
        register("smove", args -> {
            args.exact(3);
            return new SMoveCommand(args.bytes(0), args.bytes(1), args.bytes(2));
        });
        register("srandmember", args -> {
            args.atLeast(1);
            args.atMost(2);
            Long count = args.optionalCount(1);
            // a positive count is bounded by the set size; a negative one is the reply size
            if (count != null && (count > Integer.MAX_VALUE || count < -SRandMemberCommand.MAX_REPEATED_PICKS)) {
                throw TranslationException.invalidType();
            }
            return new SRandMemberCommand(args.bytes(0), count);
        });

        // List
        register("lpush", args -> {
            args.atLeast(2);
            return new LPushCommand(args.bytes(0), args.bytesFrom(1));
        });
        register("rpush", args -> {
            args.atLeast(2);
            return new RPushCommand(args.bytes(0), args.bytesFrom(1));
        });
        register("lpushx", args -> {
            args.exact(2);
            return new LPushXCommand(args.bytes(0), args.bytes(1));
        });
        register("rpushx", args -> {
            args.exact(2);
            return new RPushXCommand(args.bytes(0), args.bytes(1));
        });
        register("llen", args -> {
            args.exact(1);
            return new LLenCommand(args.bytes(0));
        });
        register("lpop", args -> {
            args.exact(1);
            return new LPopCommand(args.bytes(0));
        });
        register("rpop", args -> {
            args.exact(1);
            return new RPopCommand(args.bytes(0));
        });
        register("lrange", args -> {
            args.exact(3);
            return new LRangeCommand(args.bytes(0), args.count(1), args.count(2));
        });
        register("lindex", args -> {
            args.exact(2);
            return new LIndexCommand(args.bytes(0), args.count(1));
        });
        // Existing clients send LINSERT key and get LPOP behaviour; kept as is.
        register("linsert", args -> {
            args.exact(1);
            return new LPopCommand(args.bytes(0));
        });
    }

    private CommandTranslator() { }

    private static void register(String name, CommandParser parser) {
        parsers.put(name, parser);
    }

    /** Lower-case names of every command the translator accepts. */
    public static Set<String> commandNames() {
        return Collections.unmodifiableSet(new TreeSet<>(parsers.keySet()));
    }

    public static Command translate(RedisValue value) throws TranslationException {
        if (value instanceof RedisValue.SimpleString || value instanceof RedisValue.BulkString) {
            return translateString(((RedisValue.Text) value).getPayload());
        }
        if (value instanceof RedisValue.Array) {
            return translateArray(((RedisValue.Array) value).getElements());
        }
        throw TranslationException.unknownOp();
    }

    private static Command translateString(byte[] payload) throws TranslationException {
        switch (lowerCase(payload)) {
            case "ping": return new PingCommand(null);
            case "keys": return new KeysCommand(null);
            default: throw TranslationException.unknownOp();
        }
    }

    private static Command translateArray(List<RedisValue> array) throws TranslationException {
        if (array.isEmpty()) {
            throw TranslationException.noop();
        }
        Bytes head = Arguments.asBytes(array.get(0));
        CommandParser parser = parsers.get(lowerCase(head.toByteArray()));
        if (parser == null) {
            throw TranslationException.unknownOp();
        }
        return parser.parse(new Arguments(array.subList(1, array.size())));
    }

    private static String lowerCase(byte[] name) {
        return new String(name, StandardCharsets.UTF_8).toLowerCase(Locale.ROOT);
    }
}
