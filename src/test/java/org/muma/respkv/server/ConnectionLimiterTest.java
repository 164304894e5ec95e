package org.muma.respkv.server;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionLimiterTest {

    @Test
    void testRejectsOverLimitAndFreesSlotOnClose() {
        ConnectionLimiter limiter = new ConnectionLimiter(2);

        EmbeddedChannel first = new EmbeddedChannel(limiter);
        EmbeddedChannel second = new EmbeddedChannel(limiter);
        assertEquals(2, limiter.getConnectedClients());

        EmbeddedChannel third = new EmbeddedChannel(limiter);
        third.runPendingTasks();
        ByteBuf reply = third.readOutbound();
        assertEquals(ConnectionLimiter.REJECT_MESSAGE, reply.toString(StandardCharsets.US_ASCII));
        reply.release();
        assertFalse(third.isOpen());
        assertEquals(2, limiter.getConnectedClients());

        first.close();
        assertEquals(1, limiter.getConnectedClients());

        EmbeddedChannel fourth = new EmbeddedChannel(limiter);
        assertTrue(fourth.isOpen());
        assertEquals(2, limiter.getConnectedClients());

        second.finishAndReleaseAll();
        fourth.finishAndReleaseAll();
        assertEquals(0, limiter.getConnectedClients());
    }

    @Test
    void testAdmittedChannelPassesReadsThrough() {
        ConnectionLimiter limiter = new ConnectionLimiter(1);
        EmbeddedChannel channel = new EmbeddedChannel(limiter);

        assertTrue(channel.writeInbound(Unpooled.copiedBuffer("PING\r\n", StandardCharsets.US_ASCII)));
        ByteBuf in = channel.readInbound();
        assertEquals("PING\r\n", in.toString(StandardCharsets.US_ASCII));
        in.release();
        channel.finishAndReleaseAll();
    }
}
