package org.muma.respkv.command;

import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.store.StorageEngine;

import java.util.List;

/**
 * A command body. Receives the arguments after the command name, already checked against the
 * command's arity.
 * <p>
 * Reply-worthy failures are thrown as {@link org.muma.respkv.common.RedisException}.
 */
@FunctionalInterface
public interface CommandHandler {

    RedisMessage execute(StorageEngine storage, List<byte[]> args);
}
