package org.muma.respkv.server;

import lombok.Getter;
import org.muma.respkv.command.CommandDispatcher;
import org.muma.respkv.config.MiniKvConfig;
import org.muma.respkv.protocol.RespParser;
import org.muma.respkv.store.ExpirationReaper;
import org.muma.respkv.store.StorageEngine;
import org.muma.respkv.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Wires the server's modules together and owns their lifecycle: the store is built here,
 * shared by the dispatcher and the reaper, and released on {@link #shutdown()}.
 */
@Getter
public class RedisServerContext {

    private static final Logger log = LoggerFactory.getLogger(RedisServerContext.class);

    private final MiniKvConfig config;
    private final StorageEngine storage;
    private final CommandDispatcher dispatcher;
    private final ExpirationReaper reaper;
    private final RespParser parser;

    public RedisServerContext(MiniKvConfig config) {
        this(config, Clock.systemUTC());
    }

    public RedisServerContext(MiniKvConfig config, Clock clock) {
        this.config = config;
        this.storage = new MemoryStorageEngine(config.getLockStripes(), clock);
        this.dispatcher = new CommandDispatcher(storage);
        this.reaper = new ExpirationReaper(storage, config.getExpireHz(), config.getExpireSampleSize(),
                config.getShutdownTimeoutMs());
        // stateless, shared by every connection's decoder
        this.parser = new RespParser(config.getMaxBulkLength(), config.getMaxMultibulkLength(),
                config.getMaxInlineLength());
    }

    /**
     * Starts background tasks. Called once before the listener accepts connections.
     */
    public void init() {
        reaper.start();
        log.info("Server context initialized");
    }

    public void shutdown() {
        reaper.stop();
        log.info("Server context shut down, {} keys in memory, {} commands processed",
                storage.size(), dispatcher.getProcessedCommands());
    }
}
