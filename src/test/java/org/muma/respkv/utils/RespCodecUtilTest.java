package org.muma.respkv.utils;

import io.netty.buffer.ByteBuf;
import org.junit.jupiter.api.Test;
import org.muma.respkv.protocol.RedisRequest;
import org.muma.respkv.protocol.RespParser;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RespCodecUtilTest {

    @Test
    void testEncodeCommand() {
        byte[] bytes = RespCodecUtil.toBytes("SET", "k", "héllo");
        assertEquals("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$6\r\nhéllo\r\n", new String(bytes, StandardCharsets.UTF_8));
    }

    @Test
    void testServerParserReadsEncodedCommand() {
        ByteBuf buf = RespCodecUtil.encodeCommand("LPUSH", "list", "", "b");
        try {
            RedisRequest request = new RespParser().parseRequest(buf);
            assertEquals("LPUSH", request.name());
            assertEquals(3, request.args().size());
            assertEquals(0, request.args().get(1).length);
            assertFalse(buf.isReadable());
        } finally {
            buf.release();
        }
    }
}
