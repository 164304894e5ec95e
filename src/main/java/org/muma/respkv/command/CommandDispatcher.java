package org.muma.respkv.command;

import org.muma.respkv.common.RedisException;
import org.muma.respkv.protocol.ErrorMessage;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.RedisRequest;
import org.muma.respkv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Looks a request up in the {@link CommandTable}, checks its arity and runs it against the store.
 * <p>
 * Every outcome is a reply: application failures thrown as {@link RedisException} become error
 * replies with their own text, anything else becomes a generic internal error. Nothing escapes to
 * the connection.
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private static final long SLOW_COMMAND_MILLIS = 10;
    static final String ERR_INTERNAL = "ERR internal error";

    private final StorageEngine storage;
    private final LongAdder processed = new LongAdder();
    private final LongAdder failed = new LongAdder();

    public CommandDispatcher(StorageEngine storage) {
        this.storage = storage;
        log.info("CommandDispatcher initialized. Total commands registered: {}", CommandTable.size());
    }

    public RedisMessage dispatch(RedisRequest request) {
        String name = request.rawName();
        CommandSpec spec = CommandTable.lookup(name);
        if (spec == null) {
            log.debug("Command not found: {}", name);
            failed.increment();
            return new ErrorMessage(unknownCommand(name, request.args()));
        }
        if (!spec.acceptsArgCount(request.size())) {
            failed.increment();
            return new ErrorMessage(CommandSupport.wrongArgs(spec.name()).getMessage());
        }

        processed.increment();
        long startTime = System.nanoTime();
        try {
            RedisMessage response = spec.handler().execute(storage, request.args());

            long duration = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);
            if (duration > SLOW_COMMAND_MILLIS) {
                log.warn("Slow command detected: {} cost {}ms", spec.name(), duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} cost {}ms", spec.name(), duration);
            }
            return response;
        } catch (RedisException e) {
            // expected client errors: WRONGTYPE, bad numbers, syntax
            failed.increment();
            log.debug("Command {} failed: {}", spec.name(), e.getMessage());
            return new ErrorMessage(e.getMessage());
        } catch (RuntimeException e) {
            failed.increment();
            log.error("Internal error processing command: {}", spec.name(), e);
            return new ErrorMessage(ERR_INTERNAL);
        }
    }

    static String unknownCommand(String name, List<byte[]> args) {
        StringBuilder sb = new StringBuilder("ERR unknown command '")
                .append(name)
                .append("', with args beginning with: ");
        for (byte[] arg : args) {
            sb.append('\'').append(new String(arg, StandardCharsets.UTF_8)).append("' ");
        }
        // an error reply is a single line
        return sb.toString().replace('\r', ' ').replace('\n', ' ');
    }

    public long getProcessedCommands() {
        return processed.sum();
    }

    public long getFailedCommands() {
        return failed.sum();
    }

    public StorageEngine getStorage() {
        return storage;
    }
}
