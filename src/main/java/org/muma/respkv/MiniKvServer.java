package org.muma.respkv;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.muma.respkv.config.MiniKvConfig;
import org.muma.respkv.protocol.RespDecoder;
import org.muma.respkv.protocol.RespEncoder;
import org.muma.respkv.server.ConnectionLimiter;
import org.muma.respkv.server.RedisCommandHandler;
import org.muma.respkv.server.RedisServerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * TCP listener. Accepts connections, builds each one's pipeline and drives the graceful stop.
 * <p>
 * Pipeline per connection: connection limiter, RESP decoder, RESP encoder, command handler.
 */
public class MiniKvServer {

    private static final Logger log = LoggerFactory.getLogger(MiniKvServer.class);

    private final MiniKvConfig config;
    private final RedisServerContext context;
    private final ConnectionLimiter limiter;
    private final RespEncoder encoder = new RespEncoder();
    private final ChannelGroup clients = new DefaultChannelGroup("minikv-clients", GlobalEventExecutor.INSTANCE);

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;
    private volatile boolean stopped;

    public MiniKvServer(MiniKvConfig config) {
        this(new RedisServerContext(config));
    }

    public MiniKvServer(RedisServerContext context) {
        this.context = context;
        this.config = context.getConfig();
        this.limiter = new ConnectionLimiter(config.getMaxClients());
    }

    /**
     * Binds and returns once the port is accepting connections.
     */
    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("Server already started");
        }
        context.init();

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads());
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    // TCP handshake details on the boss channel
                    .handler(new LoggingHandler(LogLevel.DEBUG))
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            clients.add(ch);
                            ch.pipeline()
                                    .addLast(limiter)
                                    .addLast(new RespDecoder(context.getParser()))
                                    .addLast(encoder)
                                    .addLast(new RedisCommandHandler(context.getDispatcher()));
                        }
                    });

            log.info("Starting mini-kv server on {}:{}", config.getBind(), config.getPort());
            serverChannel = bootstrap.bind(config.getBind(), config.getPort()).sync().channel();
            log.info("mini-kv started successfully on port {}", getPort());
        } catch (InterruptedException | RuntimeException e) {
            log.error("Failed to start server", e);
            releaseResources();
            throw e;
        }
    }

    /**
     * The bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        Channel channel = serverChannel;
        if (channel == null) {
            return -1;
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    /**
     * Stops accepting, lets every connection finish the command it is running and flush its
     * replies, then closes connections, background tasks and event loops.
     */
    public synchronized void stop() {
        if (stopped || serverChannel == null) {
            return;
        }
        stopped = true;
        long timeoutMs = config.getShutdownTimeoutMs();
        log.info("Shutting down mini-kv, {} open connections", clients.size());

        serverChannel.close().awaitUninterruptibly(timeoutMs);
        // the empty write queues behind any reply still pending on each channel's event loop
        clients.writeAndFlush(Unpooled.EMPTY_BUFFER).awaitUninterruptibly(timeoutMs);
        clients.close().awaitUninterruptibly(timeoutMs);

        releaseResources();
        log.info("mini-kv stopped");
    }

    private void releaseResources() {
        context.shutdown();
        long timeoutMs = config.getShutdownTimeoutMs();
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, timeoutMs, TimeUnit.MILLISECONDS).awaitUninterruptibly(timeoutMs);
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, timeoutMs, TimeUnit.MILLISECONDS).awaitUninterruptibly(timeoutMs);
        }
    }

    /**
     * Blocks until the server channel closes.
     */
    public void awaitTermination() throws InterruptedException {
        Channel channel = serverChannel;
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }

    public RedisServerContext getContext() {
        return context;
    }

    public int getConnectedClients() {
        return limiter.getConnectedClients();
    }

    public static void main(String[] args) throws InterruptedException {
        MiniKvConfig config = MiniKvConfig.load(args);
        MiniKvServer server = new MiniKvServer(config);
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "minikv-shutdown"));
        server.awaitTermination();
    }
}
