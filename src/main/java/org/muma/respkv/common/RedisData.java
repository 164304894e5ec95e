package org.muma.respkv.common;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;

/**
 * One keyspace entry: the value plus its absolute expiry in epoch millis (-1 = never).
 * The variant of {@link #value} is fixed for the entry's lifetime.
 */
@Getter
@AllArgsConstructor
public class RedisData {

    public static final long NO_EXPIRE = -1;

    private final RedisValue value;

    @Setter
    private long expireAt;

    public RedisData(RedisValue value) {
        this(value, NO_EXPIRE);
    }

    public RedisDataType getType() {
        return value.type();
    }

    public boolean hasExpire() {
        return expireAt != NO_EXPIRE;
    }

    public boolean isExpired(long now) {
        return expireAt != NO_EXPIRE && expireAt <= now;
    }
}
