package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RespDecoderTest {

    private static ByteBuf bytes(String s) {
        return Unpooled.copiedBuffer(s, StandardCharsets.UTF_8);
    }

    @Test
    void testRequestSplitAcrossReads() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        assertFalse(channel.writeInbound(bytes("*2\r\n$3\r\nGET\r")));
        assertNull(channel.readInbound());
        assertTrue(channel.writeInbound(bytes("\n$3\r\nfoo\r\n")));

        RedisRequest request = channel.readInbound();
        assertEquals("GET", request.name());
        assertEquals("foo", new String(request.args().get(0), StandardCharsets.UTF_8));
        assertFalse(channel.finish());
    }

    @Test
    void testPipelinedRequestsInOneRead() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        channel.writeInbound(bytes("PING\r\n\r\n*1\r\n$4\r\nPING\r\n*2\r\n$4\r\nECHO\r\n$1\r\nx\r\n"));

        assertEquals("PING", ((RedisRequest) channel.readInbound()).name());
        assertEquals("PING", ((RedisRequest) channel.readInbound()).name());
        assertEquals("ECHO", ((RedisRequest) channel.readInbound()).name());
        // the blank line produced nothing
        assertNull(channel.readInbound());
        channel.finishAndReleaseAll();
    }

    @Test
    void testProtocolErrorClosesWithoutReply() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        channel.writeInbound(bytes("*1\r\n$4\r\nPING\r\n*1\r\n$bad\r\n*1\r\n$4\r\nPING\r\n"));
        channel.runPendingTasks();

        // the request before the garbage still went through
        RedisRequest first = channel.readInbound();
        assertEquals("PING", first.name());
        // nothing after it
        assertNull(channel.readInbound());
        assertFalse(channel.isOpen());

        // only the empty flush marker was written
        ByteBuf written = channel.readOutbound();
        if (written != null) {
            assertEquals(0, written.readableBytes());
            written.release();
        }
        channel.finishAndReleaseAll();
    }
}
