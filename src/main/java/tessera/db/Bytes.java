package tessera.db;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Immutable byte sequence used for every key, field, member and value in the store.
 * Equality is exact byte equality, so instances can be used as map keys.
 */
public final class Bytes implements Comparable<Bytes> {
    private final byte[] data;
    private int hash; // 0 until first computed

    private Bytes(byte[] data) {
        this.data = data;
    }

    /** Copies {@code data}; later changes to the array are not seen. */
    public static Bytes of(byte[] data) {
        return new Bytes(data.clone());
    }

    public static Bytes of(String s) {
        return new Bytes(s.getBytes(StandardCharsets.UTF_8));
    }

    public int length() {
        return data.length;
    }

    public byte[] toByteArray() {
        return data.clone();
    }

    /**
     * Parses the content as UTF-8 text holding a base-10 signed 64-bit integer.
     *
     * @throws NumberFormatException if the bytes are not valid UTF-8 or not an integer
     */
    public long parseLong() {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new NumberFormatException("value is not valid UTF-8");
        }
        return Long.parseLong(text);
    }

    /** One char per byte, so text matching on the result is byte-exact. */
    public String toLatin1() {
        return new String(data, StandardCharsets.ISO_8859_1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bytes)) return false;
        return Arrays.equals(data, ((Bytes) o).data);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0 && data.length > 0) {
            h = Arrays.hashCode(data);
            hash = h;
        }
        return h;
    }

    @Override
    public int compareTo(Bytes other) {
        return Arrays.compareUnsigned(data, other.data);
    }

    @Override
    public String toString() {
        return new String(data, StandardCharsets.UTF_8);
    }
}
