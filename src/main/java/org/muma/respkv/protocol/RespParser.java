package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Stateless RESP parser.
 * <p>
 * Every parse method either consumes exactly one complete value from the buffer, or returns
 * {@code null} and leaves the reader index where it was so the caller can append more bytes and
 * retry. Structurally broken input raises {@link RespProtocolException}.
 * <p>
 * Request side accepts the multi-bulk form ({@code *<n>\r\n$<len>\r\n<bytes>\r\n...}) and the
 * legacy inline form (one line of whitespace separated tokens). Reply side decodes all five
 * reply types and is used by clients and tests.
 */
public class RespParser {

    public static final long DEFAULT_MAX_BULK_LENGTH = 512L * 1024 * 1024;
    public static final int DEFAULT_MAX_MULTIBULK_LENGTH = 1024 * 1024;
    public static final int DEFAULT_MAX_INLINE_LENGTH = 64 * 1024;

    private static final byte CR = '\r';
    private static final byte LF = '\n';

    private final long maxBulkLength;
    private final int maxMultibulkLength;
    private final int maxInlineLength;

    public RespParser() {
        this(DEFAULT_MAX_BULK_LENGTH, DEFAULT_MAX_MULTIBULK_LENGTH, DEFAULT_MAX_INLINE_LENGTH);
    }

    public RespParser(long maxBulkLength, int maxMultibulkLength, int maxInlineLength) {
        // a bulk payload has to fit into a single byte[]
        this.maxBulkLength = Math.min(maxBulkLength, Integer.MAX_VALUE - 2);
        this.maxMultibulkLength = maxMultibulkLength;
        this.maxInlineLength = maxInlineLength;
    }

    // ------------------------------------------------------------------ requests

    /**
     * Decodes the next request.
     *
     * @return the request, {@link RedisRequest#EMPTY} for a blank line or a zero-length
     * multi-bulk header, or {@code null} when the buffer does not hold a complete request yet
     */
    public RedisRequest parseRequest(ByteBuf in) {
        if (!in.isReadable()) {
            return null;
        }
        int start = in.readerIndex();
        if (in.getByte(start) == '*') {
            return parseMultiBulk(in, start);
        }
        return parseInline(in, start);
    }

    private RedisRequest parseMultiBulk(ByteBuf in, int start) {
        int lineEnd = findLineEnd(in, start);
        if (lineEnd < 0) {
            checkHeaderLength(in, start, "too big mbulk count string");
            return null;
        }
        long count = parseNumber(in, start + 1, lineEnd, "invalid multibulk length");
        if (count > maxMultibulkLength) {
            throw new RespProtocolException("invalid multibulk length");
        }
        int pos = lineEnd + 2;
        if (count <= 0) {
            in.readerIndex(pos);
            return RedisRequest.EMPTY;
        }

        List<byte[]> parts = new ArrayList<>((int) Math.min(count, 1024));
        for (long i = 0; i < count; i++) {
            if (pos >= in.writerIndex()) {
                return null;
            }
            byte tag = in.getByte(pos);
            if (tag != '$') {
                throw new RespProtocolException("expected '$', got '" + (char) tag + "'");
            }
            int end = findLineEnd(in, pos);
            if (end < 0) {
                checkHeaderLength(in, pos, "too big bulk count string");
                return null;
            }
            long length = parseNumber(in, pos + 1, end, "invalid bulk length");
            if (length < 0 || length > maxBulkLength) {
                throw new RespProtocolException("invalid bulk length");
            }
            int dataStart = end + 2;
            if ((long) in.writerIndex() - dataStart < length + 2) {
                return null;
            }
            int dataEnd = dataStart + (int) length;
            if (in.getByte(dataEnd) != CR || in.getByte(dataEnd + 1) != LF) {
                throw new RespProtocolException("expected CRLF after bulk payload");
            }
            byte[] part = new byte[(int) length];
            in.getBytes(dataStart, part);
            parts.add(part);
            pos = dataEnd + 2;
        }
        in.readerIndex(pos);
        return new RedisRequest(parts);
    }

    private RedisRequest parseInline(ByteBuf in, int start) {
        int lf = in.indexOf(start, in.writerIndex(), LF);
        if (lf < 0) {
            if (in.readableBytes() > maxInlineLength) {
                throw new RespProtocolException("too big inline request");
            }
            return null;
        }
        int end = lf;
        if (end > start && in.getByte(end - 1) == CR) {
            end--;
        }
        if (end - start > maxInlineLength) {
            throw new RespProtocolException("too big inline request");
        }

        List<byte[]> parts = new ArrayList<>();
        int tokenStart = -1;
        for (int i = start; i < end; i++) {
            byte b = in.getByte(i);
            boolean space = b == ' ' || b == '\t';
            if (space && tokenStart >= 0) {
                parts.add(copy(in, tokenStart, i));
                tokenStart = -1;
            } else if (!space && tokenStart < 0) {
                tokenStart = i;
            }
        }
        if (tokenStart >= 0) {
            parts.add(copy(in, tokenStart, end));
        }
        in.readerIndex(lf + 1);
        return parts.isEmpty() ? RedisRequest.EMPTY : new RedisRequest(parts);
    }

    // ------------------------------------------------------------------ replies

    /**
     * Decodes the next reply value, or returns {@code null} if it is not complete yet.
     */
    public RedisMessage parseMessage(ByteBuf in) {
        int start = in.readerIndex();
        int[] cursor = {start};
        RedisMessage message = readMessage(in, cursor);
        if (message != null) {
            in.readerIndex(cursor[0]);
        }
        return message;
    }

    private RedisMessage readMessage(ByteBuf in, int[] cursor) {
        int pos = cursor[0];
        if (pos >= in.writerIndex()) {
            return null;
        }
        int lineEnd = findLineEnd(in, pos);
        if (lineEnd < 0) {
            return null;
        }
        byte tag = in.getByte(pos);
        int next = lineEnd + 2;
        switch (tag) {
            case '+' -> {
                cursor[0] = next;
                return new SimpleString(in.toString(pos + 1, lineEnd - pos - 1, StandardCharsets.UTF_8));
            }
            case '-' -> {
                cursor[0] = next;
                return new ErrorMessage(in.toString(pos + 1, lineEnd - pos - 1, StandardCharsets.UTF_8));
            }
            case ':' -> {
                cursor[0] = next;
                return new RedisInteger(parseNumber(in, pos + 1, lineEnd, "invalid integer"));
            }
            case '$' -> {
                long length = parseNumber(in, pos + 1, lineEnd, "invalid bulk length");
                if (length == -1) {
                    cursor[0] = next;
                    return BulkString.NULL;
                }
                if (length < 0 || length > maxBulkLength) {
                    throw new RespProtocolException("invalid bulk length");
                }
                if ((long) in.writerIndex() - next < length + 2) {
                    return null;
                }
                int dataEnd = next + (int) length;
                if (in.getByte(dataEnd) != CR || in.getByte(dataEnd + 1) != LF) {
                    throw new RespProtocolException("expected CRLF after bulk payload");
                }
                byte[] content = new byte[(int) length];
                in.getBytes(next, content);
                cursor[0] = dataEnd + 2;
                return new BulkString(content);
            }
            case '*' -> {
                long count = parseNumber(in, pos + 1, lineEnd, "invalid multibulk length");
                if (count == -1) {
                    cursor[0] = next;
                    return RedisArray.NULL;
                }
                if (count < 0 || count > maxMultibulkLength) {
                    throw new RespProtocolException("invalid multibulk length");
                }
                RedisMessage[] elements = new RedisMessage[(int) count];
                cursor[0] = next;
                for (int i = 0; i < count; i++) {
                    RedisMessage element = readMessage(in, cursor);
                    if (element == null) {
                        return null;
                    }
                    elements[i] = element;
                }
                return new RedisArray(elements);
            }
            default -> throw new RespProtocolException("unknown reply type '" + (char) tag + "'");
        }
    }

    // ------------------------------------------------------------------ helpers

    /**
     * Index of the CR of the next CRLF at or after {@code from}, or -1 if no LF arrived yet.
     */
    private int findLineEnd(ByteBuf in, int from) {
        int lf = in.indexOf(from, in.writerIndex(), LF);
        if (lf < 0) {
            return -1;
        }
        if (lf == from || in.getByte(lf - 1) != CR) {
            throw new RespProtocolException("expected CRLF line terminator");
        }
        return lf - 1;
    }

    private void checkHeaderLength(ByteBuf in, int from, String message) {
        if (in.writerIndex() - from > maxInlineLength) {
            throw new RespProtocolException(message);
        }
    }

    /**
     * Parses a signed decimal in {@code [from, to)}; rejects empty input, stray characters and
     * overflow.
     */
    private long parseNumber(ByteBuf in, int from, int to, String message) {
        if (from >= to) {
            throw new RespProtocolException(message);
        }
        boolean negative = false;
        int i = from;
        if (in.getByte(i) == '-') {
            negative = true;
            i++;
            if (i == to) {
                throw new RespProtocolException(message);
            }
        }
        long value = 0;
        for (; i < to; i++) {
            byte b = in.getByte(i);
            if (b < '0' || b > '9') {
                throw new RespProtocolException(message);
            }
            int digit = b - '0';
            if (value > (Long.MAX_VALUE - digit) / 10) {
                throw new RespProtocolException(message);
            }
            value = value * 10 + digit;
        }
        return negative ? -value : value;
    }

    private static byte[] copy(ByteBuf in, int from, int to) {
        byte[] bytes = new byte[to - from];
        in.getBytes(from, bytes);
        return bytes;
    }
}
