package org.muma.respkv.command.impl;

import org.muma.respkv.common.Bytes;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.RedisException;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;
import org.muma.respkv.store.StorageEngine;
import org.muma.respkv.utils.GlobPattern;

import java.util.List;

import static org.muma.respkv.command.CommandSupport.bytesReply;
import static org.muma.respkv.command.CommandSupport.key;
import static org.muma.respkv.command.CommandSupport.toKeys;
import static org.muma.respkv.command.CommandSupport.parseLong;

/**
 * Generic keyspace commands: DEL EXISTS EXPIRE PEXPIRE EXPIREAT TTL PTTL PERSIST TYPE KEYS.
 */
public final class KeyCommands {

    private KeyCommands() {
    }

    public static RedisMessage del(StorageEngine storage, List<byte[]> args) {
        List<Bytes> keys = toKeys(args, 0);
        long removed = storage.atomically(keys, () -> {
            long n = 0;
            for (Bytes key : keys) {
                if (storage.remove(key)) {
                    n++;
                }
            }
            return n;
        });
        return new RedisInteger(removed);
    }

    // EXISTS k k counts k twice
    public static RedisMessage exists(StorageEngine storage, List<byte[]> args) {
        List<Bytes> keys = toKeys(args, 0);
        long found = storage.atomically(keys, () -> {
            long n = 0;
            for (Bytes key : keys) {
                if (storage.exists(key)) {
                    n++;
                }
            }
            return n;
        });
        return new RedisInteger(found);
    }

    public static RedisMessage expire(StorageEngine storage, List<byte[]> args) {
        long millis = toMillis(parseLong(args.get(1)), "expire");
        return expireIn(storage, key(args.get(0)), millis, "expire");
    }

    public static RedisMessage pexpire(StorageEngine storage, List<byte[]> args) {
        return expireIn(storage, key(args.get(0)), parseLong(args.get(1)), "pexpire");
    }

    public static RedisMessage expireAt(StorageEngine storage, List<byte[]> args) {
        long at = toMillis(parseLong(args.get(1)), "expireat");
        return RedisInteger.of(storage.expireAt(key(args.get(0)), at));
    }

    private static RedisMessage expireIn(StorageEngine storage, Bytes key, long millis, String command) {
        long now = storage.now();
        if (millis > 0 && now > Long.MAX_VALUE - millis) {
            throw invalidExpire(command);
        }
        // a non-positive ttl lands in the past and deletes the key
        long at = millis <= 0 ? now : now + millis;
        return RedisInteger.of(storage.expireAt(key, at));
    }

    private static long toMillis(long seconds, String command) {
        if (seconds > Long.MAX_VALUE / 1000 || seconds < Long.MIN_VALUE / 1000) {
            throw invalidExpire(command);
        }
        return seconds * 1000;
    }

    static RedisException invalidExpire(String command) {
        return new RedisException("ERR invalid expire time in '" + command + "' command");
    }

    public static RedisMessage ttl(StorageEngine storage, List<byte[]> args) {
        long remaining = remainingMillis(storage, key(args.get(0)));
        if (remaining < 0) {
            return new RedisInteger(remaining);
        }
        return new RedisInteger((remaining + 500) / 1000);
    }

    public static RedisMessage pttl(StorageEngine storage, List<byte[]> args) {
        return new RedisInteger(remainingMillis(storage, key(args.get(0))));
    }

    /**
     * -2 absent, -1 no expiry, otherwise milliseconds left.
     */
    private static long remainingMillis(StorageEngine storage, Bytes key) {
        long expireAt = storage.getExpireAt(key);
        if (expireAt < 0) {
            return expireAt;
        }
        return Math.max(0, expireAt - storage.now());
    }

    public static RedisMessage persist(StorageEngine storage, List<byte[]> args) {
        return RedisInteger.of(storage.persist(key(args.get(0))));
    }

    public static RedisMessage type(StorageEngine storage, List<byte[]> args) {
        RedisDataType type = storage.type(key(args.get(0)));
        return new SimpleString(type == null ? "none" : type.typeName());
    }

    public static RedisMessage keys(StorageEngine storage, List<byte[]> args) {
        GlobPattern pattern = GlobPattern.compile(args.get(0));
        List<Bytes> matched = storage.keys(k -> pattern.matches(k.array()));
        return bytesReply(matched);
    }
}
