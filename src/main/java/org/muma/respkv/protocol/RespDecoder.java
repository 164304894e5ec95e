package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Inbound RESP request decoder.
 * <p>
 * {@link ByteToMessageDecoder} keeps the cumulation buffer and calls {@link #decode} until no
 * more progress is made, so a single read may emit several pipelined requests and a request split
 * across reads is emitted once its last byte arrives.
 * <p>
 * A protocol error is fatal: the rest of the input is discarded, replies already queued for
 * earlier requests are flushed, and the channel is closed without answering the broken request.
 */
public class RespDecoder extends ByteToMessageDecoder {

    private static final Logger log = LoggerFactory.getLogger(RespDecoder.class);

    private final RespParser parser;
    private boolean failed;

    public RespDecoder() {
        this(new RespParser());
    }

    public RespDecoder(RespParser parser) {
        this.parser = parser;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (failed) {
            in.skipBytes(in.readableBytes());
            return;
        }
        RedisRequest request;
        try {
            request = parser.parseRequest(in);
        } catch (RespProtocolException e) {
            failed = true;
            log.warn("Closing connection {}: {}", ctx.channel().remoteAddress(), e.getMessage());
            in.skipBytes(in.readableBytes());
            ctx.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE);
            return;
        }
        if (request == null) {
            return; // wait for more bytes
        }
        if (!request.isEmpty()) {
            out.add(request);
        }
    }
}
