package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RespParserTest {

    private final RespParser parser = new RespParser();
    private final List<ByteBuf> buffers = new ArrayList<>();

    @AfterEach
    void releaseBuffers() {
        buffers.forEach(ByteBuf::release);
    }

    private ByteBuf buf(String s) {
        ByteBuf buf = Unpooled.buffer();
        buf.writeCharSequence(s, StandardCharsets.UTF_8);
        buffers.add(buf);
        return buf;
    }

    private static List<String> parts(RedisRequest request) {
        List<String> result = new ArrayList<>();
        for (byte[] part : request.parts()) {
            result.add(new String(part, StandardCharsets.UTF_8));
        }
        return result;
    }

    @Test
    void testMultiBulkRequest() {
        ByteBuf in = buf("*3\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n");
        RedisRequest request = parser.parseRequest(in);

        assertEquals(List.of("SET", "foo", "bar"), parts(request));
        assertEquals("SET", request.name());
        assertFalse(in.isReadable());
    }

    @Test
    void testBulkPayloadIsBinarySafe() {
        ByteBuf in = buf("*2\r\n$3\r\nGET\r\n$4\r\na\r\nb\r\n");
        RedisRequest request = parser.parseRequest(in);
        assertEquals(List.of("GET", "a\r\nb"), parts(request));
    }

    @Test
    void testIncompleteInputLeavesReaderIndex() {
        String full = "*2\r\n$3\r\nGET\r\n$3\r\nfoo\r\n";
        // every proper prefix is incomplete
        for (int cut = 1; cut < full.length(); cut++) {
            ByteBuf in = buf(full.substring(0, cut));
            assertNull(parser.parseRequest(in), "prefix of length " + cut);
            assertEquals(0, in.readerIndex());
        }
    }

    @Test
    void testPipelinedRequestsParseOneAtATime() {
        ByteBuf in = buf("*1\r\n$4\r\nPING\r\n*2\r\n$4\r\nECHO\r\n$2\r\nhi\r\n*1\r\n$3\r\nGE");
        assertEquals(List.of("PING"), parts(parser.parseRequest(in)));
        assertEquals(List.of("ECHO", "hi"), parts(parser.parseRequest(in)));
        int before = in.readerIndex();
        assertNull(parser.parseRequest(in));
        assertEquals(before, in.readerIndex());
    }

    @Test
    void testInlineRequest() {
        ByteBuf in = buf("SET  key\tvalue\r\nPING\n");
        assertEquals(List.of("SET", "key", "value"), parts(parser.parseRequest(in)));
        assertEquals(List.of("PING"), parts(parser.parseRequest(in)));
        assertFalse(in.isReadable());
    }

    @Test
    void testBlankLinesAndEmptyArrays() {
        ByteBuf in = buf("\r\n*0\r\n*-1\r\n");
        assertSame(RedisRequest.EMPTY, parser.parseRequest(in));
        assertSame(RedisRequest.EMPTY, parser.parseRequest(in));
        assertSame(RedisRequest.EMPTY, parser.parseRequest(in));
        assertFalse(in.isReadable());
    }

    @Test
    void testInvalidBulkLength() {
        assertThrows(RespProtocolException.class, () -> parser.parseRequest(buf("*1\r\n$bad\r\n")));
        assertThrows(RespProtocolException.class, () -> parser.parseRequest(buf("*1\r\n$-5\r\n")));
        assertThrows(RespProtocolException.class, () -> parser.parseRequest(buf("*x\r\n")));
    }

    @Test
    void testMissingTerminatorAfterPayload() {
        RespProtocolException e = assertThrows(RespProtocolException.class,
                () -> parser.parseRequest(buf("*1\r\n$3\r\nfooXY")));
        assertTrue(e.getMessage().startsWith("Protocol error"));
    }

    @Test
    void testElementMustBeBulk() {
        assertThrows(RespProtocolException.class, () -> parser.parseRequest(buf("*1\r\n:5\r\n")));
    }

    @Test
    void testLineMustEndWithCrlf() {
        assertThrows(RespProtocolException.class, () -> parser.parseRequest(buf("*1\n$4\r\nPING\r\n")));
    }

    @Test
    void testDeclaredLengthCeilings() {
        RespParser small = new RespParser(10, 4, 32);
        assertThrows(RespProtocolException.class, () -> small.parseRequest(buf("*1\r\n$11\r\n")));
        assertThrows(RespProtocolException.class, () -> small.parseRequest(buf("*5\r\n")));
        // an unterminated inline line longer than the limit
        assertThrows(RespProtocolException.class, () -> small.parseRequest(buf("x".repeat(40))));
        // the same within the limit just waits
        assertNull(small.parseRequest(buf("x".repeat(20))));
    }

    @Test
    void testParseReplies() {
        ByteBuf in = buf("+OK\r\n-ERR boom\r\n:42\r\n$-1\r\n*-1\r\n$3\r\nbar\r\n*2\r\n$1\r\na\r\n:1\r\n");
        assertEquals(SimpleString.OK, parser.parseMessage(in));
        assertEquals(new ErrorMessage("ERR boom"), parser.parseMessage(in));
        assertEquals(new RedisInteger(42), parser.parseMessage(in));
        assertEquals(BulkString.NULL, parser.parseMessage(in));
        assertEquals(RedisArray.NULL, parser.parseMessage(in));
        assertEquals(new BulkString("bar"), parser.parseMessage(in));
        assertEquals(new RedisArray(new RedisMessage[]{new BulkString("a"), RedisInteger.ONE}), parser.parseMessage(in));
        assertFalse(in.isReadable());
    }

    @Test
    void testIncompleteReplyArray() {
        ByteBuf in = buf("*2\r\n$1\r\na\r\n");
        assertNull(parser.parseMessage(in));
        assertEquals(0, in.readerIndex());
    }
}
