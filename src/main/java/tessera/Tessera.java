package tessera;

import tessera.commands.CommandTranslator;
import tessera.db.StoreContext;
import tessera.engine.Engine;
import tessera.network.ClientHandler;
import tessera.protocol.netty.NettyRespDecoder;
import tessera.protocol.netty.NettyRespEncoder;
import tessera.utils.Log;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tessera: an in-memory key/value server speaking RESP.
 */
public class Tessera {

    private static final String CONFIG_FILE = "tessera.conf";

    // --- METRICS ---
    public static final AtomicLong totalCommands = new AtomicLong(0);
    public static final AtomicInteger activeConnections = new AtomicInteger(0);

    private static volatile boolean isRunning = true;

    public static void printBanner(Config config) {
        Log.info("\n" +
                "  _____                              \n" +
                " |_   _|__  ___ ___  ___ _ __ __ _   \n" +
                "   | |/ _ \\/ __/ __|/ _ \\ '__/ _` |  \n" +
                "   | |  __/\\__ \\__ \\  __/ | | (_| |  \n" +
                "   |_|\\___||___/___/\\___|_|  \\__,_|  \n" +
                "                                     \n" +
                " :: Tessera ::      (v" + config.version + ") \n" +
                " :: Engine ::       Java \n");
    }

    public static void main(String[] args) throws Exception {
        Config config = Config.load(args.length > 0 ? args[0] : CONFIG_FILE);
        Log.setLevel(config.logLevel);

        StoreContext context = new StoreContext();
        Engine engine = new Engine(context);
        Log.info("Registered " + CommandTranslator.commandNames().size() + " commands");

        startMonitor(context, config.statsIntervalSeconds);
        printBanner(config);

        EventLoopGroup bossGroup = new NioEventLoopGroup(1);
        EventLoopGroup workerGroup = new NioEventLoopGroup(config.workerThreads);
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
             .channel(NioServerSocketChannel.class)
             .childHandler(new ChannelInitializer<SocketChannel>() {
                 @Override
                 public void initChannel(SocketChannel ch) throws Exception {
                     ch.pipeline().addLast(new NettyRespDecoder());
                     ch.pipeline().addLast(new NettyRespEncoder());
                     ch.pipeline().addLast(new ClientHandler(engine));
                 }
             });

            ChannelFuture f = b.bind(config.bind, config.port).sync();
            Log.info("Ready on " + config.bind + ":" + config.port);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                Log.info("Shutting down...");
                isRunning = false;
                bossGroup.shutdownGracefully();
                workerGroup.shutdownGracefully();
            }));

            f.channel().closeFuture().sync();
        } finally {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
        }
    }

    // Logs clients, keys and throughput while there is anything to report.
    private static void startMonitor(StoreContext context, int intervalSeconds) {
        if (intervalSeconds <= 0) return;
        Thread monitor = new Thread(() -> {
            long lastCount = 0;
            while (isRunning) {
                try {
                    Thread.sleep(intervalSeconds * 1000L);
                    long currentCount = totalCommands.get();
                    long ops = (currentCount - lastCount) / intervalSeconds;
                    lastCount = currentCount;

                    if (ops > 0 || activeConnections.get() > 0) {
                        Log.info(String.format("[STATS] Clients: %d | Keys: %d | OPS: %d cmd/s",
                            activeConnections.get(), context.size(), ops));
                    }
                } catch (InterruptedException e) {
                    break;
                }
            }
        }, "stats-monitor");
        monitor.setDaemon(true);
        monitor.start();
    }
}
