package org.muma.respkv.protocol;

import java.util.Arrays;
import java.util.List;

// *<count> - null elements encodes as *-1
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public static final RedisArray NULL = new RedisArray(null);
    public static final RedisArray EMPTY = new RedisArray(new RedisMessage[0]);

    public static RedisArray of(List<? extends RedisMessage> elements) {
        return new RedisArray(elements.toArray(new RedisMessage[0]));
    }

    public static RedisArray ofBulks(List<byte[]> values) {
        RedisMessage[] result = new RedisMessage[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = new BulkString(values.get(i));
        }
        return new RedisArray(result);
    }

    public boolean isNull() {
        return elements == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RedisArray other)) return false;
        return Arrays.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        return elements == null ? "RedisArray[nil]" : "RedisArray" + Arrays.toString(elements);
    }
}
