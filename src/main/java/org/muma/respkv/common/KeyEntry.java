package org.muma.respkv.common;

/**
 * Detached view of one entry, handed to snapshot consumers (a future persistence or
 * replication layer). The value is a private copy.
 */
public record KeyEntry(Bytes key, RedisValue value, long expireAt) {

    public RedisDataType type() {
        return value.type();
    }
}
