package org.muma.respkv.command.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.respkv.common.Bytes;
import org.muma.respkv.common.RedisException;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.store.StorageEngine;
import org.muma.respkv.store.WrongTypeException;
import org.muma.respkv.store.impl.MemoryStorageEngine;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HashCommandsTest {

    private StorageEngine storage;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorageEngine();
    }

    private List<byte[]> args(String... args) {
        List<byte[]> list = new ArrayList<>(args.length);
        for (String a : args) {
            list.add(a.getBytes(StandardCharsets.UTF_8));
        }
        return list;
    }

    private Map<String, String> getAll(String key) {
        RedisMessage[] flat = ((RedisArray) HashCommands.hgetall(storage, args(key))).elements();
        Map<String, String> map = new HashMap<>();
        for (int i = 0; i < flat.length; i += 2) {
            map.put(((BulkString) flat[i]).asString(), ((BulkString) flat[i + 1]).asString());
        }
        return map;
    }

    @Test
    void testHsetCountsNewFieldsOnly() {
        assertEquals(new RedisInteger(2), HashCommands.hset(storage, args("h", "a", "1", "b", "2")));
        assertEquals(new RedisInteger(1), HashCommands.hset(storage, args("h", "a", "10", "c", "3")));

        assertEquals(new BulkString("10"), HashCommands.hget(storage, args("h", "a")));
        assertEquals(BulkString.NULL, HashCommands.hget(storage, args("h", "zz")));
        assertEquals(Map.of("a", "10", "b", "2", "c", "3"), getAll("h"));
        assertEquals(new RedisInteger(3), HashCommands.hlen(storage, args("h")));
    }

    @Test
    void testHsetOddPairs() {
        RedisException e = assertThrows(RedisException.class, () -> HashCommands.hset(storage, args("h", "a", "1", "b")));
        assertEquals("ERR wrong number of arguments for 'hset' command", e.getMessage());
        assertFalse(storage.exists(Bytes.of("h")));
    }

    @Test
    void testHdelAndEmptyHashRemoval() {
        HashCommands.hset(storage, args("h", "a", "1", "b", "2"));

        assertEquals(new RedisInteger(1), HashCommands.hdel(storage, args("h", "a", "nope")));
        assertEquals(RedisInteger.ONE, HashCommands.hexists(storage, args("h", "b")));
        assertEquals(RedisInteger.ZERO, HashCommands.hexists(storage, args("h", "a")));

        assertEquals(new RedisInteger(1), HashCommands.hdel(storage, args("h", "b")));
        assertFalse(storage.exists(Bytes.of("h")));
        assertEquals(RedisInteger.ZERO, HashCommands.hdel(storage, args("h", "b")));
        assertEquals(RedisArray.EMPTY, HashCommands.hgetall(storage, args("h")));
    }

    @Test
    void testHincrby() {
        assertEquals(new RedisInteger(5), HashCommands.hincrby(storage, args("h", "n", "5")));
        assertEquals(new RedisInteger(-1), HashCommands.hincrby(storage, args("h", "n", "-6")));

        HashCommands.hset(storage, args("h", "text", "abc", "max", String.valueOf(Long.MAX_VALUE)));
        RedisException notInt = assertThrows(RedisException.class, () -> HashCommands.hincrby(storage, args("h", "text", "1")));
        assertEquals("ERR hash value is not an integer", notInt.getMessage());
        RedisException overflow = assertThrows(RedisException.class, () -> HashCommands.hincrby(storage, args("h", "max", "1")));
        assertEquals(RedisException.ERR_OVERFLOW, overflow.getMessage());
        RedisException badDelta = assertThrows(RedisException.class, () -> HashCommands.hincrby(storage, args("h", "n", "x")));
        assertEquals(RedisException.ERR_NOT_INTEGER, badDelta.getMessage());

        assertEquals(new BulkString("-1"), HashCommands.hget(storage, args("h", "n")));
    }

    @Test
    void testWrongType() {
        ListCommands.rpush(storage, args("l", "a"));
        assertThrows(WrongTypeException.class, () -> HashCommands.hset(storage, args("l", "f", "v")));
        assertThrows(WrongTypeException.class, () -> HashCommands.hget(storage, args("l", "f")));
        assertThrows(WrongTypeException.class, () -> HashCommands.hgetall(storage, args("l")));
    }
}
