package tessera.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import tessera.db.Bytes;
import tessera.engine.Reply;
import tessera.protocol.Resp;

/**
 * Encodes {@link Reply} values into RESP.
 */
public class NettyRespEncoder extends MessageToByteEncoder<Reply> {

    @Override
    protected void encode(ChannelHandlerContext ctx, Reply msg, ByteBuf out) {
        write(msg, out);
    }

    static void write(Reply reply, ByteBuf out) {
        switch (reply.getType()) {
            case OK:
            case STATUS:
                Resp.writeSimpleString(out, reply.getText());
                break;
            case NIL:
                Resp.writeNullBulkString(out);
                break;
            case VALUE:
                Resp.writeBulkString(out, reply.getValue().toByteArray());
                break;
            case VALUES:
                // Empty lists go out as *0, never as a null array
                Resp.writeArrayHeader(out, reply.getValues().size());
                for (Bytes value : reply.getValues()) {
                    Resp.writeBulkString(out, value.toByteArray());
                }
                break;
            case ARRAY:
                Resp.writeArrayHeader(out, reply.getElements().size());
                for (Reply element : reply.getElements()) {
                    write(element, out);
                }
                break;
            case INTEGER:
                Resp.writeInteger(out, reply.getInteger());
                break;
            case ERROR:
                Resp.writeError(out, reply.getText());
                break;
            default:
                throw new IllegalStateException("Unhandled reply type " + reply.getType());
        }
    }
}
