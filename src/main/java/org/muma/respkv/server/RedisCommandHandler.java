package org.muma.respkv.server;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.muma.respkv.command.CommandDispatcher;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.RedisRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Per-connection request loop.
 * <p>
 * Netty hands a channel's requests to this handler one at a time on the channel's event loop.
 * Each one is dispatched synchronously and its reply queued with {@code write}; the queue is
 * flushed once the current read burst is drained. Replies therefore leave in request order, and a
 * pipelining client gets one flush per burst instead of one per command.
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisRequest> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    private final CommandDispatcher dispatcher;
    private boolean closing;

    public RedisCommandHandler(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client connected: {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client disconnected: {}", ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisRequest request) {
        if (closing) {
            // pipelined after QUIT
            return;
        }
        RedisMessage reply = dispatcher.dispatch(request);
        if ("QUIT".equals(request.name())) {
            closing = true;
            ctx.writeAndFlush(reply).addListener(ChannelFutureListener.CLOSE);
            return;
        }
        ctx.write(reply);
    }

    @Override
    public void channelReadComplete(ChannelHandlerContext ctx) {
        ctx.flush();
        ctx.fireChannelReadComplete();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof IOException) {
            // connection reset and friends
            log.info("Connection {} closed by I/O error: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("Unexpected error on connection {}", ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }
}
