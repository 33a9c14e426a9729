package tessera.engine;

import tessera.commands.CommandTranslator;
import tessera.commands.TranslationException;
import tessera.db.Bytes;
import tessera.db.StoreContext;
import tessera.protocol.RedisValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ServerEngineTest {

    private Engine engine;

    @BeforeEach
    public void setUp() {
        engine = new Engine(new StoreContext());
    }

    private Reply run(RedisValue request) throws TranslationException {
        return engine.execute(CommandTranslator.translate(request));
    }

    private static Set<Bytes> setOf(String... items) {
        Set<Bytes> out = new HashSet<>();
        for (String s : items) out.add(Bytes.of(s));
        return out;
    }

    @Test
    public void testPing() throws TranslationException {
        assertEquals(Reply.status("PONG"), run(RedisValue.simple("PING")));
        assertEquals(Reply.status("PONG"), run(RedisValue.command("PING")));
        assertEquals(Reply.value(Bytes.of("hi")), run(RedisValue.command("PING", "hi")));
    }

    @Test
    public void testKeysSpansAllContainers() throws TranslationException {
        run(RedisValue.command("SET", "str", "v"));
        run(RedisValue.command("HSET", "hash", "f", "v"));
        run(RedisValue.command("SADD", "set", "m"));
        run(RedisValue.command("RPUSH", "list", "x"));
        run(RedisValue.command("SADD", "str", "m"));

        List<Bytes> all = run(RedisValue.simple("KEYS")).getValues();
        assertEquals(4, all.size(), "A key in two containers is listed once");
        assertEquals(setOf("str", "hash", "set", "list"), new HashSet<>(all));
    }

    @Test
    public void testKeysPattern() throws TranslationException {
        for (String k : Arrays.asList("user:1", "user:2", "user:10", "order:1")) {
            run(RedisValue.command("SET", k, "v"));
        }
        assertEquals(setOf("user:1", "user:2", "user:10"),
                new HashSet<>(run(RedisValue.command("KEYS", "user:*")).getValues()));
        assertEquals(setOf("user:1", "user:2"),
                new HashSet<>(run(RedisValue.command("KEYS", "user:?")).getValues()));
        assertEquals(setOf("user:1", "order:1"),
                new HashSet<>(run(RedisValue.command("KEYS", "*:1")).getValues()));
        assertTrue(run(RedisValue.command("KEYS", "nomatch*")).getValues().isEmpty());
    }

    @Test
    public void testKeysOnEmptyStore() throws TranslationException {
        Reply reply = run(RedisValue.command("KEYS", "*"));
        assertEquals(Reply.Type.VALUES, reply.getType());
        assertTrue(reply.getValues().isEmpty());
    }
}
