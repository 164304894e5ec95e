package org.muma.respkv.command.impl;

import org.muma.respkv.common.Bytes;
import org.muma.respkv.common.RedisSet;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.store.StorageEngine;

import java.util.List;

import static org.muma.respkv.command.CommandSupport.bytesReply;
import static org.muma.respkv.command.CommandSupport.key;

public final class SetCommands {

    private SetCommands() {
    }

    public static RedisMessage sadd(StorageEngine storage, List<byte[]> args) {
        int added = storage.update(key(args.get(0)), RedisSet.class, set -> {
            int n = 0;
            for (int i = 1; i < args.size(); i++) {
                n += set.add(Bytes.wrap(args.get(i)));
            }
            return n;
        });
        return new RedisInteger(added);
    }

    public static RedisMessage srem(StorageEngine storage, List<byte[]> args) {
        int removed = storage.updateExisting(key(args.get(0)), RedisSet.class, set -> {
            int n = 0;
            for (int i = 1; i < args.size(); i++) {
                n += set.remove(Bytes.wrap(args.get(i)));
            }
            return n;
        }, 0);
        return new RedisInteger(removed);
    }

    public static RedisMessage smembers(StorageEngine storage, List<byte[]> args) {
        return storage.read(key(args.get(0)), RedisSet.class, set -> bytesReply(set.getAll()), RedisArray.EMPTY);
    }

    public static RedisMessage sismember(StorageEngine storage, List<byte[]> args) {
        Bytes member = Bytes.wrap(args.get(1));
        return storage.read(key(args.get(0)), RedisSet.class,
                set -> RedisInteger.of(set.contains(member)), RedisInteger.ZERO);
    }

    public static RedisMessage scard(StorageEngine storage, List<byte[]> args) {
        return storage.read(key(args.get(0)), RedisSet.class, set -> new RedisInteger(set.size()), RedisInteger.ZERO);
    }
}
