package tessera.network;

import tessera.Tessera;
import tessera.commands.Command;
import tessera.commands.CommandTranslator;
import tessera.commands.TranslationException;
import tessera.engine.Engine;
import tessera.engine.Reply;
import tessera.protocol.RedisValue;
import tessera.utils.Log;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;

/**
 * One per connection. Turns each decoded request into a command, runs it and writes the reply.
 * Requests on a connection are answered in the order they arrive.
 */
public class ClientHandler extends ChannelInboundHandlerAdapter {
    private final Engine engine;

    public ClientHandler(Engine engine) {
        this.engine = engine;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        Tessera.activeConnections.incrementAndGet();
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        Tessera.activeConnections.decrementAndGet();
        super.channelInactive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (msg instanceof RedisValue) {
            Reply reply = handleRequest((RedisValue) msg);
            if (reply != null) {
                ctx.writeAndFlush(reply);
            }
        } else {
            super.channelRead(ctx, msg);
        }
    }

    /**
     * Returns the reply for one request, or null when nothing should be sent back.
     */
    Reply handleRequest(RedisValue request) {
        Tessera.totalCommands.incrementAndGet();
        Command command;
        try {
            command = CommandTranslator.translate(request);
        } catch (TranslationException e) {
            if (e.getKind() == TranslationException.Kind.NOOP) return null;
            if (Log.isDebugEnabled()) {
                Log.debug("Rejected " + request + ": " + e.getMessage());
            }
            return Reply.error(e.getMessage());
        }

        if (Log.isDebugEnabled()) {
            Log.debug("Executing " + command.name());
        }
        try {
            return engine.execute(command);
        } catch (RuntimeException e) {
            Log.error("Error executing " + command.name(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return Reply.error("ERR " + message);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Log.warn("Connection " + ctx.channel().remoteAddress() + " failed: " + cause.getMessage());
        ctx.close();
    }
}
