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

public class SetEngineTest {

    private StoreContext context;
    private Engine engine;

    @BeforeEach
    public void setUp() {
        context = new StoreContext();
        engine = new Engine(context);
    }

    private Reply run(String... parts) throws TranslationException {
        return engine.execute(CommandTranslator.translate(RedisValue.command(parts)));
    }

    private static Set<Bytes> setOf(String... members) {
        Set<Bytes> out = new HashSet<>();
        for (String m : members) out.add(Bytes.of(m));
        return out;
    }

    private Set<Bytes> members(String key) throws TranslationException {
        Reply reply = run("SMEMBERS", key);
        assertEquals(Reply.Type.VALUES, reply.getType());
        Set<Bytes> out = new HashSet<>(reply.getValues());
        assertEquals(reply.getValues().size(), out.size(), "SMEMBERS returned duplicates");
        return out;
    }

    @Test
    public void testAddRemove() throws TranslationException {
        assertEquals(Reply.integer(3), run("SADD", "s", "a", "b", "c"));
        assertEquals(Reply.integer(1), run("SADD", "s", "a", "d"));
        assertEquals(Reply.integer(4), run("SCARD", "s"));
        assertEquals(Reply.integer(2), run("SREM", "s", "a", "b", "x"));
        assertEquals(setOf("c", "d"), members("s"));
        assertEquals(Reply.integer(0), run("SREM", "none", "a"));
    }

    @Test
    public void testIsMember() throws TranslationException {
        run("SADD", "s", "a");
        assertEquals(Reply.integer(1), run("SISMEMBER", "s", "a"));
        assertEquals(Reply.integer(0), run("SISMEMBER", "s", "b"));
        assertEquals(Reply.integer(0), run("SISMEMBER", "none", "a"));
        assertEquals(Reply.integer(0), run("SCARD", "none"));
        assertTrue(members("none").isEmpty());
    }

    @Test
    public void testAlgebra() throws TranslationException {
        run("SADD", "x", "a", "b", "c");
        run("SADD", "y", "b", "c", "d");
        run("SADD", "z", "c", "e");

        assertEquals(setOf("a"), new HashSet<>(run("SDIFF", "x", "y").getValues()));
        assertEquals(setOf("a", "b", "c", "d", "e"), new HashSet<>(run("SUNION", "x", "y", "z").getValues()));
        assertEquals(setOf("c"), new HashSet<>(run("SINTER", "x", "y", "z").getValues()));
        assertTrue(run("SINTER", "x", "missing").getValues().isEmpty());
        assertEquals(setOf("a", "b", "c"), new HashSet<>(run("SDIFF", "x", "missing").getValues()));
    }

    @Test
    public void testStoreVariants() throws TranslationException {
        run("SADD", "x", "a", "b");
        run("SADD", "y", "b", "c");

        assertEquals(Reply.integer(3), run("SUNIONSTORE", "u", "x", "y"));
        assertEquals(setOf("a", "b", "c"), members("u"));

        assertEquals(Reply.integer(1), run("SINTERSTORE", "i", "x", "y"));
        assertEquals(setOf("b"), members("i"));

        assertEquals(Reply.integer(1), run("SDIFFSTORE", "d", "x", "y"));
        assertEquals(setOf("a"), members("d"));
    }

    @Test
    public void testStoreOverwritesAndCanTargetASource() throws TranslationException {
        run("SADD", "x", "a", "b");
        run("SADD", "y", "b");
        assertEquals(Reply.integer(1), run("SDIFFSTORE", "x", "x", "y"));
        assertEquals(setOf("a"), members("x"));

        run("SADD", "dst", "old");
        assertEquals(Reply.integer(0), run("SINTERSTORE", "dst", "x", "y"));
        assertTrue(members("dst").isEmpty());
    }

    @Test
    public void testStoredResultIsIndependent() throws TranslationException {
        run("SADD", "x", "a");
        run("SUNIONSTORE", "copy", "x", "nothing");
        run("SADD", "x", "b");
        assertEquals(setOf("a"), members("copy"));
    }

    @Test
    public void testPop() throws TranslationException {
        run("SADD", "s", "a", "b", "c");
        Reply one = run("SPOP", "s");
        assertEquals(Reply.Type.VALUE, one.getType());
        assertTrue(setOf("a", "b", "c").contains(one.getValue()));
        assertEquals(Reply.integer(0), run("SISMEMBER", "s", one.getValue().toString()));

        Reply rest = run("SPOP", "s", "10");
        assertEquals(2, rest.getValues().size());
        assertEquals(Reply.integer(0), run("SCARD", "s"));

        assertEquals(Reply.nil(), run("SPOP", "s"));
        assertEquals(Reply.nil(), run("SPOP", "none"));
        assertTrue(run("SPOP", "none", "3").getValues().isEmpty());
    }

    @Test
    public void testMove() throws TranslationException {
        run("SADD", "src", "a", "b");
        assertEquals(Reply.integer(1), run("SMOVE", "src", "dst", "a"));
        assertEquals(setOf("b"), members("src"));
        assertEquals(setOf("a"), members("dst"));
        assertEquals(Reply.integer(0), run("SMOVE", "src", "dst", "zzz"));
        assertEquals(Reply.integer(0), run("SMOVE", "none", "dst", "a"));
    }

    @Test
    public void testMoveWithinSameSet() throws TranslationException {
        run("SADD", "s", "a");
        assertEquals(Reply.integer(1), run("SMOVE", "s", "s", "a"));
        assertEquals(setOf("a"), members("s"));
    }

    @Test
    public void testRandomMember() throws TranslationException {
        run("SADD", "s", "a", "b", "c");
        Reply single = run("SRANDMEMBER", "s");
        assertTrue(setOf("a", "b", "c").contains(single.getValue()));
        assertEquals(Reply.integer(3), run("SCARD", "s"));

        List<Bytes> distinct = run("SRANDMEMBER", "s", "2").getValues();
        assertEquals(2, distinct.size());
        assertEquals(2, new HashSet<>(distinct).size());

        assertEquals(3, run("SRANDMEMBER", "s", "5").getValues().size());

        List<Bytes> repeats = run("SRANDMEMBER", "s", "-7").getValues();
        assertEquals(7, repeats.size());
        assertTrue(setOf("a", "b", "c").containsAll(repeats));

        assertEquals(Reply.nil(), run("SRANDMEMBER", "none"));
        assertTrue(run("SRANDMEMBER", "none", "-3").getValues().isEmpty());
        assertTrue(run("SRANDMEMBER", "s", "0").getValues().isEmpty());
    }

    @Test
    public void testEmptiedSetIsKept() throws TranslationException {
        run("SADD", "s", "a");
        run("SREM", "s", "a");
        assertEquals(1, context.sets().size());
        assertEquals(Arrays.asList(Bytes.of("s")), context.sets().keys());
    }
}
