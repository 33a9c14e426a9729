package tessera.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;
import tessera.protocol.RedisValue;
import tessera.protocol.Resp;
import tessera.utils.Log;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Netty decoder for RESP. Emits one {@link RedisValue} per complete top-level frame.
 *
 * <p>A frame that is not complete yet leaves the buffer untouched and waits for more bytes.
 * Lines not starting with a RESP type byte are inline commands (telnet style) and come out
 * as an array of bulk strings. Malformed length headers close the connection.
 */
public class NettyRespDecoder extends ByteToMessageDecoder {

    // Marks "need more bytes". Distinct from the null variants of the protocol.
    private static final RedisValue INCOMPLETE = RedisValue.array();

    private static final int MAX_NESTING = 32;

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        while (in.isReadable()) {
            int start = in.readerIndex();
            RedisValue value;
            try {
                value = parse(in, 0);
            } catch (CorruptedFrameException e) {
                Log.warn("Closing " + ctx.channel().remoteAddress() + ": " + e.getMessage());
                in.skipBytes(in.readableBytes());
                ctx.close();
                return;
            }
            if (value == INCOMPLETE) {
                in.readerIndex(start);
                return;
            }
            out.add(value);
        }
    }

    private RedisValue parse(ByteBuf in, int depth) {
        if (depth > MAX_NESTING) {
            throw new CorruptedFrameException("arrays nested deeper than " + MAX_NESTING);
        }
        byte type = in.getByte(in.readerIndex());
        switch (type) {
            case Resp.SIMPLE_STRING:
            case Resp.ERROR:
            case Resp.INTEGER: {
                in.skipBytes(1);
                byte[] line = readLine(in);
                if (line == null) return INCOMPLETE;
                if (type == Resp.SIMPLE_STRING) return new RedisValue.SimpleString(line);
                if (type == Resp.ERROR) return new RedisValue.ErrorString(line);
                return RedisValue.integer(parseLength(line, Long.MIN_VALUE, Long.MAX_VALUE));
            }
            case Resp.BULK_STRING:
                in.skipBytes(1);
                return parseBulkString(in);
            case Resp.ARRAY:
                in.skipBytes(1);
                return parseArray(in, depth);
            default:
                return parseInline(in);
        }
    }

    private RedisValue parseBulkString(ByteBuf in) {
        byte[] header = readLine(in);
        if (header == null) return INCOMPLETE;
        int length = (int) parseLength(header, -1, Resp.MAX_BULK_LENGTH);
        if (length == -1) return RedisValue.NULL_BULK_STRING;

        // Check if we have enough data to determine terminator
        if (in.readableBytes() < length + 1) return INCOMPLETE;
        int terminatorLength = (in.getByte(in.readerIndex() + length) == '\r') ? 2 : 1;
        if (in.readableBytes() < length + terminatorLength) return INCOMPLETE;

        byte[] content = new byte[length];
        in.readBytes(content);
        if (in.getByte(in.readerIndex() + terminatorLength - 1) != '\n') {
            throw new CorruptedFrameException("bulk string not terminated by CRLF");
        }
        in.skipBytes(terminatorLength);
        return new RedisValue.BulkString(content);
    }

    private RedisValue parseArray(ByteBuf in, int depth) {
        byte[] header = readLine(in);
        if (header == null) return INCOMPLETE;
        int count = (int) parseLength(header, -1, Resp.MAX_BULK_LENGTH);
        if (count == -1) return RedisValue.NULL_ARRAY;

        // Each element takes at least 3 bytes; don't preallocate for a count we can't have.
        List<RedisValue> elements = new ArrayList<>(Math.min(count, in.readableBytes() / 3 + 1));
        for (int i = 0; i < count; i++) {
            if (!in.isReadable()) return INCOMPLETE;
            RedisValue element = parse(in, depth + 1);
            if (element == INCOMPLETE) return INCOMPLETE;
            elements.add(element);
        }
        return new RedisValue.Array(elements);
    }

    // Inline command: "PING" or "SET key val"
    private RedisValue parseInline(ByteBuf in) {
        byte[] line = readLine(in);
        if (line == null) return INCOMPLETE;
        String[] parts = new String(line, StandardCharsets.UTF_8).trim().split("\\s+");
        List<RedisValue> args = new ArrayList<>(parts.length);
        for (String part : parts) {
            if (!part.isEmpty()) args.add(RedisValue.bulk(part));
        }
        return new RedisValue.Array(args);
    }

    /**
     * Reads up to the next line terminator (CRLF, or a bare LF) and consumes it.
     * Returns null, consuming nothing, when no terminator has arrived yet.
     */
    private byte[] readLine(ByteBuf in) {
        int eol = findEndOfLine(in);
        if (eol == -1) return null;
        byte[] line = new byte[eol - in.readerIndex()];
        in.readBytes(line);
        int terminatorLength = (in.getByte(eol) == '\r') ? 2 : 1;
        in.skipBytes(terminatorLength);
        return line;
    }

    private int findEndOfLine(ByteBuf in) {
        int n = in.writerIndex();
        for (int i = in.readerIndex(); i < n; i++) {
            byte b = in.getByte(i);
            if (b == '\n') { // Accept any line that ends with \n
                return (i > in.readerIndex() && in.getByte(i - 1) == '\r') ? i - 1 : i;
            }
        }
        return -1;
    }

    private static long parseLength(byte[] line, long min, long max) {
        String text = new String(line, StandardCharsets.US_ASCII);
        long value;
        try {
            value = Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new CorruptedFrameException("invalid number '" + text + "'");
        }
        if (value < min || value > max) {
            throw new CorruptedFrameException("number out of range: " + value);
        }
        return value;
    }
}
