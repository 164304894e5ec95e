package org.muma.respkv.server;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.AttributeKey;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Caps the number of concurrent client connections.
 * <p>
 * A connection over the limit gets {@code -ERR max number of clients reached} and is closed
 * before any of its input is read. Sits first in the pipeline, so the reply is written as raw
 * bytes.
 */
@ChannelHandler.Sharable
public class ConnectionLimiter extends ChannelInboundHandlerAdapter {

    private static final Logger log = LoggerFactory.getLogger(ConnectionLimiter.class);

    static final String REJECT_MESSAGE = "-ERR max number of clients reached\r\n";

    private static final AttributeKey<Boolean> ADMITTED = AttributeKey.valueOf("minikv.admitted");

    private final int maxClients;
    private final AtomicInteger connected = new AtomicInteger();

    public ConnectionLimiter(int maxClients) {
        this.maxClients = maxClients;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        int current = connected.incrementAndGet();
        if (current > maxClients) {
            connected.decrementAndGet();
            log.warn("Rejecting {}: max number of clients ({}) reached", ctx.channel().remoteAddress(), maxClients);
            ByteBuf reply = Unpooled.copiedBuffer(REJECT_MESSAGE, StandardCharsets.US_ASCII);
            ctx.writeAndFlush(reply).addListener(ChannelFutureListener.CLOSE);
            return;
        }
        ctx.channel().attr(ADMITTED).set(Boolean.TRUE);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (Boolean.TRUE.equals(ctx.channel().attr(ADMITTED).getAndSet(null))) {
            connected.decrementAndGet();
            super.channelInactive(ctx);
        }
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (Boolean.TRUE.equals(ctx.channel().attr(ADMITTED).get())) {
            super.channelRead(ctx, msg);
        } else {
            // rejected connection, drop whatever arrived before the close
            ReferenceCountUtil.release(msg);
        }
    }

    public int getConnectedClients() {
        return connected.get();
    }
}
