package org.muma.respkv.benchmark;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.muma.respkv.protocol.RespParser;
import org.muma.respkv.utils.RespCodecUtil;

import java.util.concurrent.CountDownLatch;

/**
 * Pipelined load generator against a running server.
 * <p>
 * Usage: {@code MiniKvBenchmark [host] [port]}
 */
public class MiniKvBenchmark {

    private static final int CONCURRENCY = 50;
    private static final int REQUESTS_PER_CLIENT = 10000;
    private static final int TOTAL_REQUESTS = CONCURRENCY * REQUESTS_PER_CLIENT;
    private static final int PIPELINE_DEPTH = 50;

    // String
    private static final ByteBuf SET_CMD = buf("SET", "foo", "bar");
    private static final ByteBuf GET_CMD = buf("GET", "foo");
    private static final ByteBuf INCR_CMD = buf("INCR", "counter");

    // Hash
    private static final ByteBuf HSET_CMD = buf("HSET", "myhash", "field1", "val1");
    private static final ByteBuf HGET_CMD = buf("HGET", "myhash", "field1");

    // List, LRANGE rather than LPOP so the list never drains
    private static final ByteBuf LPUSH_CMD = buf("LPUSH", "mylist", "val");
    private static final ByteBuf LRANGE_CMD = buf("LRANGE", "mylist", "0", "10");

    // Set
    private static final ByteBuf SADD_CMD = buf("SADD", "myset", "val");
    private static final ByteBuf SISMEMBER_CMD = buf("SISMEMBER", "myset", "val");

    // ZSet
    private static final ByteBuf ZADD_CMD = buf("ZADD", "myzset", "100", "val");
    private static final ByteBuf ZRANGE_CMD = buf("ZRANGE", "myzset", "0", "10");

    private static ByteBuf buf(String... command) {
        return Unpooled.unreleasableBuffer(RespCodecUtil.encodeCommand(command));
    }

    public static void main(String[] args) throws InterruptedException {
        String host = args.length > 0 ? args[0] : "127.0.0.1";
        int port = args.length > 1 ? Integer.parseInt(args[1]) : 6379;

        System.out.println("========== mini-kv Benchmark ==========");
        System.out.println("Target: " + host + ":" + port);
        System.out.println("Concurrency: " + CONCURRENCY);
        System.out.println("Total Requests: " + TOTAL_REQUESTS);

        EventLoopGroup group = new NioEventLoopGroup(Runtime.getRuntime().availableProcessors());
        try {
            runBenchmark(group, host, port, "SET", SET_CMD);
            runBenchmark(group, host, port, "GET", GET_CMD);
            runBenchmark(group, host, port, "INCR", INCR_CMD);

            runBenchmark(group, host, port, "HSET", HSET_CMD);
            runBenchmark(group, host, port, "HGET", HGET_CMD);

            runBenchmark(group, host, port, "LPUSH", LPUSH_CMD);
            runBenchmark(group, host, port, "LRANGE", LRANGE_CMD);

            runBenchmark(group, host, port, "SADD", SADD_CMD);
            runBenchmark(group, host, port, "SISMEMBER", SISMEMBER_CMD);

            runBenchmark(group, host, port, "ZADD", ZADD_CMD);
            runBenchmark(group, host, port, "ZRANGE", ZRANGE_CMD);
        } finally {
            group.shutdownGracefully();
        }
    }

    private static void runBenchmark(EventLoopGroup group, String host, int port, String title, ByteBuf command)
            throws InterruptedException {
        // let the previous round's garbage settle
        Thread.sleep(500);

        CountDownLatch latch = new CountDownLatch(CONCURRENCY);
        long startTime = System.nanoTime();

        Bootstrap b = new Bootstrap();
        b.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new BenchmarkHandler(command, latch));
                    }
                });

        for (int i = 0; i < CONCURRENCY; i++) {
            b.connect(host, port).addListener((ChannelFutureListener) f -> {
                if (!f.isSuccess()) {
                    System.err.println("Connect failed: " + f.cause().getMessage());
                    latch.countDown();
                }
            });
        }

        latch.await();

        long durationNs = System.nanoTime() - startTime;
        double seconds = durationNs / 1_000_000_000.0;
        double qps = TOTAL_REQUESTS / seconds;

        System.out.printf("Test: %-10s | Duration: %.2fs | QPS: %.2f%n", title, seconds, qps);
    }

    static class BenchmarkHandler extends SimpleChannelInboundHandler<ByteBuf> {
        private final ByteBuf command;
        private final CountDownLatch latch;
        private final RespParser parser = new RespParser();
        private ByteBuf cumulation;

        private int sent = 0;
        private int received = 0;

        BenchmarkHandler(ByteBuf command, CountDownLatch latch) {
            this.command = command;
            this.latch = latch;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            cumulation = ctx.alloc().buffer();
            flushBatch(ctx);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            if (cumulation != null) {
                cumulation.release();
                cumulation = null;
            }
        }

        private void flushBatch(ChannelHandlerContext ctx) {
            int batch = Math.min(PIPELINE_DEPTH, REQUESTS_PER_CLIENT - sent);
            if (batch <= 0) return;

            for (int i = 0; i < batch; i++) {
                ctx.write(command.retainedDuplicate());
                sent++;
            }
            ctx.flush();
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg) {
            cumulation.writeBytes(msg);
            // whole replies only; bulk and array replies span several lines
            while (parser.parseMessage(cumulation) != null) {
                received++;
                if (received >= REQUESTS_PER_CLIENT) {
                    ctx.close();
                    latch.countDown();
                    return;
                }
                if (received % 20 == 0 && sent < REQUESTS_PER_CLIENT) {
                    flushBatch(ctx);
                }
            }
            cumulation.discardSomeReadBytes();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            System.err.println("Benchmark connection failed: " + cause.getMessage());
            ctx.close();
            latch.countDown();
        }
    }
}
