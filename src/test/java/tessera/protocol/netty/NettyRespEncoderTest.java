package tessera.protocol.netty;

import tessera.db.Bytes;
import tessera.engine.Reply;
import io.netty.buffer.ByteBuf;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class NettyRespEncoderTest {

    private static String encode(Reply reply) {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespEncoder());
        assertTrue(channel.writeOutbound(reply));
        ByteBuf buf = channel.readOutbound();
        try {
            return buf.toString(StandardCharsets.UTF_8);
        } finally {
            buf.release();
        }
    }

    @Test
    public void testScalars() {
        assertEquals("+OK\r\n", encode(Reply.ok()));
        assertEquals("+PONG\r\n", encode(Reply.status("PONG")));
        assertEquals("$-1\r\n", encode(Reply.nil()));
        assertEquals("$5\r\nhello\r\n", encode(Reply.value(Bytes.of("hello"))));
        assertEquals("$0\r\n\r\n", encode(Reply.value(Bytes.of(""))));
        assertEquals(":-3\r\n", encode(Reply.integer(-3)));
        assertEquals("-ERR unknown command\r\n", encode(Reply.error("ERR unknown command")));
    }

    @Test
    public void testErrorWithNewlineStaysOneLine() {
        assertEquals("-ERR a b\r\n", encode(Reply.error("ERR a\nb")));
    }

    @Test
    public void testEmptyListIsEmptyArrayNotNull() {
        assertEquals("*0\r\n", encode(Reply.values(Collections.emptyList())));
    }

    @Test
    public void testValues() {
        assertEquals("*2\r\n$1\r\na\r\n$2\r\nbc\r\n",
                encode(Reply.values(Arrays.asList(Bytes.of("a"), Bytes.of("bc")))));
    }

    @Test
    public void testNestedArrayWithNil() {
        Reply reply = Reply.array(Arrays.asList(Reply.value(Bytes.of("x")), Reply.nil(), Reply.integer(2)));
        assertEquals("*3\r\n$1\r\nx\r\n$-1\r\n:2\r\n", encode(reply));
    }

    @Test
    public void testBinaryValue() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespEncoder());
        channel.writeOutbound(Reply.value(Bytes.of(new byte[]{(byte) 0xff, 0})));
        ByteBuf buf = channel.readOutbound();
        byte[] out = new byte[buf.readableBytes()];
        buf.readBytes(out);
        buf.release();
        assertArrayEquals(new byte[]{'$', '2', '\r', '\n', (byte) 0xff, 0, '\r', '\n'}, out);
    }
}
