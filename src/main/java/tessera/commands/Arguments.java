package tessera.commands;

import tessera.db.Bytes;
import tessera.protocol.RedisValue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * The arguments following a command name, with the arity checks and coercions every
 * command parser shares. Indexes are zero-based and exclude the command name.
 */
final class Arguments {
    private final List<RedisValue> tail;

    Arguments(List<RedisValue> tail) {
        this.tail = tail;
    }

    int size() {
        return tail.size();
    }

    void exact(int n) throws TranslationException {
        if (tail.size() != n) {
            throw TranslationException.wrongNumberOfArgs(n);
        }
    }

    void atLeast(int n) throws TranslationException {
        if (tail.size() < n) {
            throw TranslationException.notEnoughArgs(n);
        }
    }

    void atMost(int n) throws TranslationException {
        if (tail.size() > n) {
            throw TranslationException.wrongNumberOfArgs(n);
        }
    }

    Bytes bytes(int i) throws TranslationException {
        return asBytes(tail.get(i));
    }

    /** Null when the argument was not given. */
    Bytes optionalBytes(int i) throws TranslationException {
        return i < tail.size() ? bytes(i) : null;
    }

    // Every argument from index {@code from} on, all of which must be strings.
    List<Bytes> bytesFrom(int from) throws TranslationException {
        List<Bytes> out = new ArrayList<>(Math.max(0, tail.size() - from));
        for (int i = from; i < tail.size(); i++) {
            out.add(bytes(i));
        }
        return out;
    }

    long count(int i) throws TranslationException {
        return asCount(tail.get(i));
    }

    /** Null when the argument was not given. */
    Long optionalCount(int i) throws TranslationException {
        return i < tail.size() ? count(i) : null;
    }

    /**
     * Simple or bulk string payload. Any other wire value is an invalid argument type.
     */
    static Bytes asBytes(RedisValue value) throws TranslationException {
        if (value instanceof RedisValue.SimpleString || value instanceof RedisValue.BulkString) {
            return Bytes.of(((RedisValue.Text) value).getPayload());
        }
        throw TranslationException.invalidType();
    }

    /**
     * Native integer, or a simple or bulk string holding a base-10 integer.
     */
    static long asCount(RedisValue value) throws TranslationException {
        if (value instanceof RedisValue.Int) {
            return ((RedisValue.Int) value).getValue();
        }
        if (value instanceof RedisValue.SimpleString || value instanceof RedisValue.BulkString) {
            String text = new String(((RedisValue.Text) value).getPayload(), StandardCharsets.UTF_8);
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw TranslationException.invalidType();
            }
        }
        throw TranslationException.invalidType();
    }
}
