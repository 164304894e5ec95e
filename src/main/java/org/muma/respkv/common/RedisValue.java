package org.muma.respkv.common;

/**
 * The value held by one key. Closed set of variants; code that needs per-variant behaviour
 * switches over {@link #type()}.
 */
public sealed interface RedisValue permits RedisString, RedisList, RedisHash, RedisSet, RedisZSet {

    RedisDataType type();

    /**
     * An empty collection is indistinguishable from a missing key, so the store drops it.
     */
    boolean isEmpty();

    /**
     * Deep copy, safe to hand out of the store's lock.
     */
    RedisValue copy();

    /**
     * Empty value of the given variant, used when a write creates a new key.
     */
    static RedisValue empty(RedisDataType type) {
        return switch (type) {
            case STRING -> new RedisString(new byte[0]);
            case LIST -> new RedisList();
            case HASH -> new RedisHash();
            case SET -> new RedisSet();
            case ZSET -> new RedisZSet();
        };
    }
}
