package org.muma.respkv.common;

import java.nio.charset.StandardCharsets;

/**
 * String value. Replaced as a whole on every write, so the array is never mutated.
 */
public record RedisString(byte[] value) implements RedisValue {

    public static RedisString of(String s) {
        return new RedisString(s.getBytes(StandardCharsets.UTF_8));
    }

    public static RedisString of(long number) {
        return of(Long.toString(number));
    }

    @Override
    public RedisDataType type() {
        return RedisDataType.STRING;
    }

    @Override
    public boolean isEmpty() {
        // an empty string is still a value
        return false;
    }

    @Override
    public RedisValue copy() {
        return this;
    }

    public int length() {
        return value.length;
    }
}
