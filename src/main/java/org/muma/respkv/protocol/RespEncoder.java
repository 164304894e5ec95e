package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import java.nio.charset.StandardCharsets;

/**
 * Outbound RESP reply encoder. Stateless, so one instance is shared by every channel.
 */
@ChannelHandler.Sharable
public class RespEncoder extends MessageToByteEncoder<RedisMessage> {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL_LENGTH = "-1".getBytes(StandardCharsets.US_ASCII);

    @Override
    protected void encode(ChannelHandlerContext ctx, RedisMessage msg, ByteBuf out) {
        write(msg, out);
    }

    public static void write(RedisMessage msg, ByteBuf out) {
        if (msg instanceof SimpleString s) {
            out.writeByte('+');
            out.writeCharSequence(s.content(), StandardCharsets.UTF_8);
            out.writeBytes(CRLF);
        } else if (msg instanceof ErrorMessage e) {
            out.writeByte('-');
            out.writeCharSequence(e.content(), StandardCharsets.UTF_8);
            out.writeBytes(CRLF);
        } else if (msg instanceof RedisInteger i) {
            out.writeByte(':');
            writeNumber(i.value(), out);
        } else if (msg instanceof BulkString b) {
            out.writeByte('$');
            if (b.isNull()) {
                out.writeBytes(NULL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeNumber(b.content().length, out);
                out.writeBytes(b.content());
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            out.writeByte('*');
            if (a.isNull()) {
                out.writeBytes(NULL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeNumber(a.elements().length, out);
                for (RedisMessage element : a.elements()) {
                    write(element, out);
                }
            }
        }
    }

    private static void writeNumber(long value, ByteBuf out) {
        out.writeCharSequence(Long.toString(value), StandardCharsets.US_ASCII);
        out.writeBytes(CRLF);
    }
}
