package org.muma.respkv.common;

import java.util.Locale;

public enum RedisDataType {
    STRING(RedisString.class),
    LIST(RedisList.class),
    HASH(RedisHash.class),
    SET(RedisSet.class),
    ZSET(RedisZSet.class);

    private final Class<? extends RedisValue> valueClass;

    RedisDataType(Class<? extends RedisValue> valueClass) {
        this.valueClass = valueClass;
    }

    public Class<? extends RedisValue> valueClass() {
        return valueClass;
    }

    /**
     * Name reported by the TYPE command.
     */
    public String typeName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RedisDataType of(Class<? extends RedisValue> valueClass) {
        for (RedisDataType type : values()) {
            if (type.valueClass == valueClass) {
                return type;
            }
        }
        throw new IllegalArgumentException("Not a value variant: " + valueClass.getName());
    }
}
