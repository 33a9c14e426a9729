package tessera.protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One parsed RESP element. The set of variants is closed: simple string, error string,
 * bulk string, integer, array, null array and null bulk string.
 */
public abstract class RedisValue {
    public static final RedisValue NULL_ARRAY = new NullArray();
    public static final RedisValue NULL_BULK_STRING = new NullBulkString();

    private RedisValue() { }

    public static RedisValue simple(String s) {
        return new SimpleString(s.getBytes(StandardCharsets.UTF_8));
    }

    public static RedisValue bulk(String s) {
        return new BulkString(s.getBytes(StandardCharsets.UTF_8));
    }

    public static RedisValue integer(long i) {
        return new Int(i);
    }

    public static RedisValue array(RedisValue... elements) {
        return new Array(Arrays.asList(elements));
    }

    /** A command as clients send it: an array of bulk strings. */
    public static RedisValue command(String... parts) {
        List<RedisValue> elements = new ArrayList<>(parts.length);
        for (String part : parts) {
            elements.add(bulk(part));
        }
        return new Array(elements);
    }

    // Base for the three payload-carrying string variants.
    public abstract static class Text extends RedisValue {
        private final byte[] payload;

        Text(byte[] payload) {
            this.payload = payload;
        }

        public byte[] getPayload() {
            return payload;
        }

        @Override
        public boolean equals(Object o) {
            return o != null && o.getClass() == getClass() && Arrays.equals(payload, ((Text) o).payload);
        }

        @Override
        public int hashCode() {
            return getClass().hashCode() * 31 + Arrays.hashCode(payload);
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "(" + new String(payload, StandardCharsets.UTF_8) + ")";
        }
    }

    public static final class SimpleString extends Text {
        public SimpleString(byte[] payload) {
            super(payload);
        }
    }

    public static final class ErrorString extends Text {
        public ErrorString(byte[] payload) {
            super(payload);
        }
    }

    public static final class BulkString extends Text {
        public BulkString(byte[] payload) {
            super(payload);
        }
    }

    public static final class Int extends RedisValue {
        private final long value;

        public Int(long value) {
            this.value = value;
        }

        public long getValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Int && ((Int) o).value == value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }

        @Override
        public String toString() {
            return "Int(" + value + ")";
        }
    }

    public static final class Array extends RedisValue {
        private final List<RedisValue> elements;

        public Array(List<RedisValue> elements) {
            this.elements = Collections.unmodifiableList(elements);
        }

        public List<RedisValue> getElements() {
            return elements;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Array && elements.equals(((Array) o).elements);
        }

        @Override
        public int hashCode() {
            return elements.hashCode();
        }

        @Override
        public String toString() {
            return "Array" + elements;
        }
    }

    public static final class NullArray extends RedisValue {
        private NullArray() { }

        @Override
        public String toString() {
            return "NullArray";
        }
    }

    public static final class NullBulkString extends RedisValue {
        private NullBulkString() { }

        @Override
        public String toString() {
            return "NullBulkString";
        }
    }
}
