package tessera.engine;

import tessera.db.Bytes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of executing one command, independent of wire formatting.
 */
public final class Reply {

    public enum Type {
        /** Success without payload. */
        OK,
        /** Success carrying a short status text, e.g. PONG. */
        STATUS,
        NIL,
        /** A single value. */
        VALUE,
        /** A flat list of values; field/value pairs are flattened. */
        VALUES,
        /** Nested replies, e.g. one per requested field, nil where absent. */
        ARRAY,
        INTEGER,
        ERROR
    }

    private static final Reply OK = new Reply(Type.OK, null, null, null, 0, "OK");
    private static final Reply NIL = new Reply(Type.NIL, null, null, null, 0, null);

    private final Type type;
    private final Bytes value;
    private final List<Bytes> values;
    private final List<Reply> elements;
    private final long integer;
    private final String text;

    private Reply(Type type, Bytes value, List<Bytes> values, List<Reply> elements, long integer, String text) {
        this.type = type;
        this.value = value;
        this.values = values;
        this.elements = elements;
        this.integer = integer;
        this.text = text;
    }

    public static Reply ok() {
        return OK;
    }

    public static Reply nil() {
        return NIL;
    }

    public static Reply status(String text) {
        return new Reply(Type.STATUS, null, null, null, 0, text);
    }

    public static Reply value(Bytes value) {
        return new Reply(Type.VALUE, Objects.requireNonNull(value), null, null, 0, null);
    }

    /** {@link #nil()} when {@code value} is null. */
    public static Reply valueOrNil(Bytes value) {
        return value == null ? NIL : value(value);
    }

    public static Reply values(Collection<Bytes> values) {
        return new Reply(Type.VALUES, null, Collections.unmodifiableList(new ArrayList<>(values)), null, 0, null);
    }

    public static Reply array(List<Reply> elements) {
        return new Reply(Type.ARRAY, null, null, Collections.unmodifiableList(new ArrayList<>(elements)), 0, null);
    }

    public static Reply integer(long i) {
        return new Reply(Type.INTEGER, null, null, null, i, null);
    }

    public static Reply error(String message) {
        return new Reply(Type.ERROR, null, null, null, 0, message);
    }

    public Type getType() {
        return type;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    public Bytes getValue() {
        return value;
    }

    public List<Bytes> getValues() {
        return values;
    }

    public List<Reply> getElements() {
        return elements;
    }

    public long getInteger() {
        return integer;
    }

    /** Status text for OK/STATUS, message for ERROR. */
    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reply)) return false;
        Reply r = (Reply) o;
        return type == r.type && integer == r.integer
                && Objects.equals(value, r.value)
                && Objects.equals(values, r.values)
                && Objects.equals(elements, r.elements)
                && Objects.equals(text, r.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, values, elements, integer, text);
    }

    @Override
    public String toString() {
        switch (type) {
            case OK: return "OK";
            case NIL: return "(nil)";
            case STATUS: return text;
            case VALUE: return "\"" + value + "\"";
            case VALUES: return values.toString();
            case ARRAY: return elements.toString();
            case INTEGER: return "(integer) " + integer;
            case ERROR: return "(error) " + text;
            default: return type.name();
        }
    }
}
