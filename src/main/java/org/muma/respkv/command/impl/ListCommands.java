package org.muma.respkv.command.impl;

import org.muma.respkv.common.RedisException;
import org.muma.respkv.common.RedisList;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.store.StorageEngine;

import java.util.ArrayList;
import java.util.List;

import static org.muma.respkv.command.CommandSupport.bulk;
import static org.muma.respkv.command.CommandSupport.key;
import static org.muma.respkv.command.CommandSupport.parseLong;

public final class ListCommands {

    private ListCommands() {
    }

    public static RedisMessage lpush(StorageEngine storage, List<byte[]> args) {
        return push(storage, args, true);
    }

    public static RedisMessage rpush(StorageEngine storage, List<byte[]> args) {
        return push(storage, args, false);
    }

    private static RedisMessage push(StorageEngine storage, List<byte[]> args, boolean head) {
        List<byte[]> elements = args.subList(1, args.size());
        int size = storage.update(key(args.get(0)), RedisList.class, list -> {
            for (byte[] element : elements) {
                if (head) {
                    list.lpush(element);
                } else {
                    list.rpush(element);
                }
            }
            return list.size();
        });
        return new RedisInteger(size);
    }

    public static RedisMessage lpop(StorageEngine storage, List<byte[]> args) {
        return pop(storage, args, true);
    }

    public static RedisMessage rpop(StorageEngine storage, List<byte[]> args) {
        return pop(storage, args, false);
    }

    /**
     * Without a count: one element or nil. With a count: an array of up to count elements, or a
     * nil array when the key is absent.
     */
    private static RedisMessage pop(StorageEngine storage, List<byte[]> args, boolean head) {
        if (args.size() == 1) {
            return storage.updateExisting(key(args.get(0)), RedisList.class,
                    list -> bulk(head ? list.lpop() : list.rpop()), BulkString.NULL);
        }
        long count = parseLong(args.get(1));
        if (count < 0) {
            throw new RedisException("ERR value is out of range, must be positive");
        }
        return storage.updateExisting(key(args.get(0)), RedisList.class, list -> {
            List<byte[]> popped = new ArrayList<>((int) Math.min(count, list.size()));
            for (long i = 0; i < count && list.size() > 0; i++) {
                popped.add(head ? list.lpop() : list.rpop());
            }
            return RedisArray.ofBulks(popped);
        }, RedisArray.NULL);
    }

    public static RedisMessage lrange(StorageEngine storage, List<byte[]> args) {
        long start = parseLong(args.get(1));
        long stop = parseLong(args.get(2));
        return storage.read(key(args.get(0)), RedisList.class,
                list -> RedisArray.ofBulks(list.range(start, stop)), RedisArray.EMPTY);
    }

    public static RedisMessage llen(StorageEngine storage, List<byte[]> args) {
        return storage.read(key(args.get(0)), RedisList.class,
                list -> new RedisInteger(list.size()), RedisInteger.ZERO);
    }

    public static RedisMessage lindex(StorageEngine storage, List<byte[]> args) {
        long index = parseLong(args.get(1));
        return storage.read(key(args.get(0)), RedisList.class,
                list -> bulk(list.index(index)), BulkString.NULL);
    }
}
