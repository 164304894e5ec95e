package org.muma.respkv.common;

/**
 * An application level failure of a single command. The message is the complete error reply
 * text (including its "ERR"/"WRONGTYPE" prefix); the connection stays open.
 */
public class RedisException extends RuntimeException {

    public static final String ERR_NOT_INTEGER = "ERR value is not an integer or out of range";
    public static final String ERR_NOT_FLOAT = "ERR value is not a valid float";
    public static final String ERR_SYNTAX = "ERR syntax error";
    public static final String ERR_OVERFLOW = "ERR increment or decrement would overflow";

    public RedisException(String message) {
        super(message);
    }

    public static RedisException notInteger() {
        return new RedisException(ERR_NOT_INTEGER);
    }

    public static RedisException notFloat() {
        return new RedisException(ERR_NOT_FLOAT);
    }

    public static RedisException syntax() {
        return new RedisException(ERR_SYNTAX);
    }
}
