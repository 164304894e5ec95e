package org.muma.respkv.command.impl;

import org.muma.respkv.common.Bytes;
import org.muma.respkv.common.RedisException;
import org.muma.respkv.common.RedisHash;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.store.StorageEngine;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.muma.respkv.command.CommandSupport.addExact;
import static org.muma.respkv.command.CommandSupport.bulk;
import static org.muma.respkv.command.CommandSupport.key;
import static org.muma.respkv.command.CommandSupport.parseLong;
import static org.muma.respkv.command.CommandSupport.wrongArgs;

public final class HashCommands {

    private HashCommands() {
    }

    /**
     * HSET key field value [field value ...], replies with the number of new fields.
     */
    public static RedisMessage hset(StorageEngine storage, List<byte[]> args) {
        if (args.size() % 2 == 0) {
            throw wrongArgs("hset");
        }
        int added = storage.update(key(args.get(0)), RedisHash.class, hash -> {
            int n = 0;
            for (int i = 1; i < args.size(); i += 2) {
                n += hash.put(Bytes.wrap(args.get(i)), args.get(i + 1));
            }
            return n;
        });
        return new RedisInteger(added);
    }

    public static RedisMessage hget(StorageEngine storage, List<byte[]> args) {
        Bytes field = Bytes.wrap(args.get(1));
        return storage.read(key(args.get(0)), RedisHash.class, hash -> bulk(hash.get(field)), BulkString.NULL);
    }

    public static RedisMessage hdel(StorageEngine storage, List<byte[]> args) {
        int removed = storage.updateExisting(key(args.get(0)), RedisHash.class, hash -> {
            int n = 0;
            for (int i = 1; i < args.size(); i++) {
                n += hash.remove(Bytes.wrap(args.get(i)));
            }
            return n;
        }, 0);
        return new RedisInteger(removed);
    }

    public static RedisMessage hgetall(StorageEngine storage, List<byte[]> args) {
        return storage.read(key(args.get(0)), RedisHash.class, hash -> {
            BulkString[] flat = new BulkString[hash.size() * 2];
            int i = 0;
            for (Map.Entry<Bytes, byte[]> entry : hash.entries().entrySet()) {
                flat[i++] = new BulkString(entry.getKey().array());
                flat[i++] = new BulkString(entry.getValue());
            }
            return new RedisArray(flat);
        }, RedisArray.EMPTY);
    }

    public static RedisMessage hlen(StorageEngine storage, List<byte[]> args) {
        return storage.read(key(args.get(0)), RedisHash.class, hash -> new RedisInteger(hash.size()), RedisInteger.ZERO);
    }

    public static RedisMessage hexists(StorageEngine storage, List<byte[]> args) {
        Bytes field = Bytes.wrap(args.get(1));
        return storage.read(key(args.get(0)), RedisHash.class,
                hash -> RedisInteger.of(hash.contains(field)), RedisInteger.ZERO);
    }

    public static RedisMessage hincrby(StorageEngine storage, List<byte[]> args) {
        Bytes field = Bytes.wrap(args.get(1));
        long delta = parseLong(args.get(2));
        long value = storage.update(key(args.get(0)), RedisHash.class, hash -> {
            byte[] current = hash.get(field);
            long base = 0;
            if (current != null) {
                try {
                    base = parseLong(current);
                } catch (RedisException e) {
                    throw new RedisException("ERR hash value is not an integer");
                }
            }
            long next = addExact(base, delta);
            hash.put(field, Long.toString(next).getBytes(StandardCharsets.US_ASCII));
            return next;
        });
        return new RedisInteger(value);
    }
}
