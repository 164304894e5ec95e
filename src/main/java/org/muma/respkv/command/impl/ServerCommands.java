package org.muma.respkv.command.impl;

import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;
import org.muma.respkv.store.StorageEngine;

import java.util.List;

/**
 * Connection and server level commands. QUIT only acknowledges here; closing the connection is up
 * to the connection handler.
 */
public final class ServerCommands {

    private ServerCommands() {
    }

    public static RedisMessage ping(StorageEngine storage, List<byte[]> args) {
        if (args.isEmpty()) {
            return SimpleString.PONG;
        }
        return new BulkString(args.get(0));
    }

    public static RedisMessage echo(StorageEngine storage, List<byte[]> args) {
        return new BulkString(args.get(0));
    }

    public static RedisMessage quit(StorageEngine storage, List<byte[]> args) {
        return SimpleString.OK;
    }

    public static RedisMessage dbsize(StorageEngine storage, List<byte[]> args) {
        return new RedisInteger(storage.size());
    }

    public static RedisMessage flushdb(StorageEngine storage, List<byte[]> args) {
        storage.flush();
        return SimpleString.OK;
    }

    // clients such as redis-cli send COMMAND on connect; an empty table is enough for them
    public static RedisMessage command(StorageEngine storage, List<byte[]> args) {
        return RedisArray.EMPTY;
    }
}
