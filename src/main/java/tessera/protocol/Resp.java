package tessera.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;

public final class Resp {
    public static final byte ARRAY = '*';
    public static final byte BULK_STRING = '$';
    public static final byte SIMPLE_STRING = '+';
    public static final byte ERROR = '-';
    public static final byte INTEGER = ':';

    public static final byte[] CRLF = {'\r', '\n'};

    // Largest bulk string or array the decoder accepts (512MB, like Redis).
    public static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;

    private Resp() { }

    // --- SERIALIZATION ---
    public static void writeSimpleString(ByteBuf out, String s) {
        out.writeByte(SIMPLE_STRING);
        out.writeCharSequence(s, StandardCharsets.UTF_8);
        out.writeBytes(CRLF);
    }

    public static void writeError(ByteBuf out, String message) {
        out.writeByte(ERROR);
        // A newline inside an error would end the frame early.
        out.writeCharSequence(message.replace('\r', ' ').replace('\n', ' '), StandardCharsets.UTF_8);
        out.writeBytes(CRLF);
    }

    public static void writeInteger(ByteBuf out, long i) {
        out.writeByte(INTEGER);
        writeDecimal(out, i);
        out.writeBytes(CRLF);
    }

    public static void writeBulkString(ByteBuf out, byte[] b) {
        if (b == null) {
            writeNullBulkString(out);
            return;
        }
        out.writeByte(BULK_STRING);
        writeDecimal(out, b.length);
        out.writeBytes(CRLF);
        out.writeBytes(b);
        out.writeBytes(CRLF);
    }

    public static void writeNullBulkString(ByteBuf out) {
        out.writeByte(BULK_STRING);
        writeDecimal(out, -1);
        out.writeBytes(CRLF);
    }

    public static void writeArrayHeader(ByteBuf out, int size) {
        out.writeByte(ARRAY);
        writeDecimal(out, size);
        out.writeBytes(CRLF);
    }

    private static void writeDecimal(ByteBuf out, long value) {
        out.writeCharSequence(Long.toString(value), StandardCharsets.US_ASCII);
    }
}
