package org.muma.respkv.protocol;

/**
 * A RESP reply value. Closed set: every encoder/decoder branch covers all five.
 */
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, RedisInteger, BulkString, RedisArray {
}
