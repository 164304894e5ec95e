package org.muma.respkv.utils;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.muma.respkv.protocol.RedisRequest;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Client side RESP encoding: a command becomes a multi-bulk array of bulk strings.
 */
public final class RespCodecUtil {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    private RespCodecUtil() {
    }

    public static ByteBuf encodeCommand(RedisRequest request) {
        ByteBuf buf = Unpooled.buffer(64);
        writeCommand(request.parts(), buf);
        return buf;
    }

    public static ByteBuf encodeCommand(String... parts) {
        return encodeCommand(RedisRequest.of(parts));
    }

    public static byte[] toBytes(String... parts) {
        ByteBuf buf = encodeCommand(parts);
        try {
            byte[] bytes = new byte[buf.readableBytes()];
            buf.readBytes(bytes);
            return bytes;
        } finally {
            buf.release();
        }
    }

    public static void writeCommand(List<byte[]> parts, ByteBuf out) {
        // *<count>\r\n
        out.writeByte('*');
        out.writeCharSequence(Integer.toString(parts.size()), StandardCharsets.US_ASCII);
        out.writeBytes(CRLF);
        for (byte[] part : parts) {
            // $<length>\r\n<data>\r\n
            out.writeByte('$');
            out.writeCharSequence(Integer.toString(part.length), StandardCharsets.US_ASCII);
            out.writeBytes(CRLF);
            out.writeBytes(part);
            out.writeBytes(CRLF);
        }
    }
}
