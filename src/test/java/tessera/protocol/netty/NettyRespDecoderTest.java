package tessera.protocol.netty;

import tessera.protocol.RedisValue;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class NettyRespDecoderTest {

    private static void write(EmbeddedChannel channel, String data) {
        channel.writeInbound(Unpooled.copiedBuffer(data, StandardCharsets.UTF_8));
    }

    @Test
    public void testFragmentedPacket() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());

        write(channel, "*3\r\n$3\r\nSE");
        assertNull(channel.readInbound()); // Incomplete

        write(channel, "T\r\n$3\r\nkey\r\n$3\r\nval\r\n");
        assertEquals(RedisValue.command("SET", "key", "val"), channel.readInbound());
    }

    @Test
    public void testByteAtATime() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        String frame = "*2\r\n$4\r\nHGET\r\n$1\r\nh\r\n";
        for (int i = 0; i < frame.length() - 1; i++) {
            write(channel, frame.substring(i, i + 1));
            assertNull(channel.readInbound());
        }
        write(channel, frame.substring(frame.length() - 1));
        assertEquals(RedisValue.command("HGET", "h"), channel.readInbound());
    }

    @Test
    public void testPipelinedFrames() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        write(channel, "*1\r\n$4\r\nPING\r\n*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");
        assertEquals(RedisValue.command("PING"), channel.readInbound());
        assertEquals(RedisValue.command("GET", "k"), channel.readInbound());
        assertNull(channel.readInbound());
    }

    @Test
    public void testScalarTypes() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        write(channel, "+OK\r\n-ERR bad\r\n:-12\r\n$-1\r\n*-1\r\n$0\r\n\r\n");
        assertEquals(RedisValue.simple("OK"), channel.readInbound());
        assertEquals(new RedisValue.ErrorString("ERR bad".getBytes(StandardCharsets.UTF_8)), channel.readInbound());
        assertEquals(RedisValue.integer(-12), channel.readInbound());
        assertSame(RedisValue.NULL_BULK_STRING, channel.readInbound());
        assertSame(RedisValue.NULL_ARRAY, channel.readInbound());
        assertEquals(RedisValue.bulk(""), channel.readInbound());
    }

    @Test
    public void testNestedArray() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        write(channel, "*3\r\n:1\r\n*2\r\n+a\r\n$-1\r\n$1\r\nz\r\n");
        RedisValue expected = RedisValue.array(
                RedisValue.integer(1),
                RedisValue.array(RedisValue.simple("a"), RedisValue.NULL_BULK_STRING),
                RedisValue.bulk("z"));
        assertEquals(expected, channel.readInbound());
    }

    @Test
    public void testBulkStringIsBinarySafe() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        byte[] frame = {'$', '4', '\r', '\n', 'a', '\r', '\n', 0, '\r', '\n'};
        channel.writeInbound(Unpooled.wrappedBuffer(frame));
        RedisValue value = channel.readInbound();
        assertArrayEquals(new byte[]{'a', '\r', '\n', 0}, ((RedisValue.BulkString) value).getPayload());
    }

    @Test
    public void testEmptyArray() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        write(channel, "*0\r\n");
        assertEquals(RedisValue.array(), channel.readInbound());
    }

    @Test
    public void testInlineCommand() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        write(channel, "SET  key   value\r\n");
        assertEquals(RedisValue.command("SET", "key", "value"), channel.readInbound());

        write(channel, "PING\n");
        assertEquals(RedisValue.command("PING"), channel.readInbound());

        write(channel, "\r\n");
        assertEquals(RedisValue.array(), channel.readInbound());
    }

    @Test
    public void testLargePayloadHeaderWaits() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        write(channel, "*1\r\n$1000000\r\n");
        assertNull(channel.readInbound()); // Waiting for content
        assertTrue(channel.isOpen());
        channel.finish();
    }

    @Test
    public void testMalformedLengthClosesChannel() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        write(channel, "*ABC\r\n");
        assertFalse(channel.isOpen());

        EmbeddedChannel channel2 = new EmbeddedChannel(new NettyRespDecoder());
        write(channel2, "*2\r\n$3\r\nSET\r\n$garbage\r\n");
        assertFalse(channel2.isOpen(), "Channel should be closed on invalid bulk length");
    }

    @Test
    public void testBadBulkTerminatorClosesChannel() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        write(channel, "$3\r\nabcXY");
        assertFalse(channel.isOpen());
    }

    @Test
    public void testOutOfRangeLengthClosesChannel() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        write(channel, "$-2\r\n");
        assertFalse(channel.isOpen());

        EmbeddedChannel channel2 = new EmbeddedChannel(new NettyRespDecoder());
        write(channel2, "*99999999999\r\n");
        assertFalse(channel2.isOpen());
    }

    @Test
    public void testDeepNestingClosesChannel() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 100; i++) sb.append("*1\r\n");
        sb.append(":1\r\n");
        write(channel, sb.toString());
        assertFalse(channel.isOpen());
    }
}
