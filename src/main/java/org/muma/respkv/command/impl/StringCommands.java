package org.muma.respkv.command.impl;

import org.muma.respkv.common.Bytes;
import org.muma.respkv.common.RedisData;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.RedisException;
import org.muma.respkv.common.RedisString;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;
import org.muma.respkv.store.StorageEngine;
import org.muma.respkv.store.WrongTypeException;

import java.util.ArrayList;
import java.util.List;

import static org.muma.respkv.command.CommandSupport.addExact;
import static org.muma.respkv.command.CommandSupport.bulk;
import static org.muma.respkv.command.CommandSupport.key;
import static org.muma.respkv.command.CommandSupport.option;
import static org.muma.respkv.command.CommandSupport.parseLong;
import static org.muma.respkv.command.CommandSupport.toKeys;
import static org.muma.respkv.command.CommandSupport.wrongArgs;

/**
 * String commands. Counters keep the key's TTL; SET replaces it unless KEEPTTL is given.
 */
public final class StringCommands {

    private StringCommands() {
    }

    public static RedisMessage get(StorageEngine storage, List<byte[]> args) {
        return storage.read(key(args.get(0)), RedisString.class, s -> bulk(s.value()), BulkString.NULL);
    }

    /**
     * SET key value [NX | XX] [EX seconds | PX milliseconds | KEEPTTL]
     */
    public static RedisMessage set(StorageEngine storage, List<byte[]> args) {
        Bytes key = key(args.get(0));
        byte[] value = args.get(1);

        boolean nx = false;
        boolean xx = false;
        boolean keepTtl = false;
        long ttlMillis = -1;
        for (int i = 2; i < args.size(); i++) {
            String opt = option(args.get(i));
            switch (opt) {
                case "NX" -> {
                    if (xx) throw RedisException.syntax();
                    nx = true;
                }
                case "XX" -> {
                    if (nx) throw RedisException.syntax();
                    xx = true;
                }
                case "KEEPTTL" -> {
                    if (ttlMillis >= 0) throw RedisException.syntax();
                    keepTtl = true;
                }
                case "EX", "PX" -> {
                    if (keepTtl || ttlMillis >= 0 || i + 1 >= args.size()) {
                        throw RedisException.syntax();
                    }
                    long amount = parseLong(args.get(++i));
                    if (amount <= 0 || ("EX".equals(opt) && amount > Long.MAX_VALUE / 1000)) {
                        throw KeyCommands.invalidExpire("set");
                    }
                    ttlMillis = "EX".equals(opt) ? amount * 1000 : amount;
                }
                default -> throw RedisException.syntax();
            }
        }

        final boolean onlyIfAbsent = nx;
        final boolean onlyIfPresent = xx;
        final boolean keep = keepTtl;
        final long ttl = ttlMillis;
        return storage.compute(key, slot -> {
            RedisData current = slot.get();
            if ((onlyIfAbsent && current != null) || (onlyIfPresent && current == null)) {
                return BulkString.NULL;
            }
            long expireAt = RedisData.NO_EXPIRE;
            if (ttl >= 0) {
                expireAt = expireAfter(storage.now(), ttl);
            } else if (keep && current != null) {
                expireAt = current.getExpireAt();
            }
            slot.set(new RedisString(value), expireAt);
            return SimpleString.OK;
        });
    }

    private static long expireAfter(long now, long ttlMillis) {
        if (now > Long.MAX_VALUE - ttlMillis) {
            throw KeyCommands.invalidExpire("set");
        }
        return now + ttlMillis;
    }

    public static RedisMessage setnx(StorageEngine storage, List<byte[]> args) {
        byte[] value = args.get(1);
        return storage.compute(key(args.get(0)), slot -> {
            if (slot.get() != null) {
                return RedisInteger.ZERO;
            }
            slot.set(new RedisString(value), RedisData.NO_EXPIRE);
            return RedisInteger.ONE;
        });
    }

    // non-string keys read as nil instead of failing the whole batch
    public static RedisMessage mget(StorageEngine storage, List<byte[]> args) {
        List<Bytes> keys = toKeys(args, 0);
        return storage.atomically(keys, () -> {
            List<BulkString> values = new ArrayList<>(keys.size());
            for (Bytes key : keys) {
                values.add(storage.compute(key, slot -> {
                    RedisData data = slot.get();
                    if (data != null && data.getValue() instanceof RedisString s) {
                        return new BulkString(s.value());
                    }
                    return BulkString.NULL;
                }));
            }
            return RedisArray.of(values);
        });
    }

    public static RedisMessage mset(StorageEngine storage, List<byte[]> args) {
        if (args.size() % 2 != 0) {
            throw wrongArgs("mset");
        }
        List<Bytes> keys = new ArrayList<>(args.size() / 2);
        for (int i = 0; i < args.size(); i += 2) {
            keys.add(key(args.get(i)));
        }
        return storage.atomically(keys, () -> {
            for (int i = 0; i < keys.size(); i++) {
                storage.set(keys.get(i), new RedisString(args.get(2 * i + 1)));
            }
            return SimpleString.OK;
        });
    }

    public static RedisMessage incr(StorageEngine storage, List<byte[]> args) {
        return incrBy(storage, key(args.get(0)), 1);
    }

    public static RedisMessage decr(StorageEngine storage, List<byte[]> args) {
        return incrBy(storage, key(args.get(0)), -1);
    }

    public static RedisMessage incrby(StorageEngine storage, List<byte[]> args) {
        return incrBy(storage, key(args.get(0)), parseLong(args.get(1)));
    }

    public static RedisMessage decrby(StorageEngine storage, List<byte[]> args) {
        long delta = parseLong(args.get(1));
        if (delta == Long.MIN_VALUE) {
            throw new RedisException("ERR decrement would overflow");
        }
        return incrBy(storage, key(args.get(0)), -delta);
    }

    private static RedisMessage incrBy(StorageEngine storage, Bytes key, long delta) {
        return storage.compute(key, slot -> {
            RedisData data = slot.get();
            long current = 0;
            long expireAt = RedisData.NO_EXPIRE;
            if (data != null) {
                current = parseLong(asString(data).value());
                expireAt = data.getExpireAt();
            }
            long next = addExact(current, delta);
            slot.set(RedisString.of(next), expireAt);
            return new RedisInteger(next);
        });
    }

    public static RedisMessage append(StorageEngine storage, List<byte[]> args) {
        byte[] suffix = args.get(1);
        return storage.compute(key(args.get(0)), slot -> {
            RedisData data = slot.get();
            if (data == null) {
                slot.set(new RedisString(suffix), RedisData.NO_EXPIRE);
                return new RedisInteger(suffix.length);
            }
            byte[] current = asString(data).value();
            byte[] joined = new byte[current.length + suffix.length];
            System.arraycopy(current, 0, joined, 0, current.length);
            System.arraycopy(suffix, 0, joined, current.length, suffix.length);
            slot.set(new RedisString(joined), data.getExpireAt());
            return new RedisInteger(joined.length);
        });
    }

    public static RedisMessage strlen(StorageEngine storage, List<byte[]> args) {
        return storage.read(key(args.get(0)), RedisString.class, s -> new RedisInteger(s.length()), RedisInteger.ZERO);
    }

    private static RedisString asString(RedisData data) {
        if (data.getValue() instanceof RedisString s) {
            return s;
        }
        throw new WrongTypeException(RedisDataType.STRING, data.getType());
    }
}
