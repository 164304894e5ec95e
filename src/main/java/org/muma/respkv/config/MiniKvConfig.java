package org.muma.respkv.config;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * Server configuration.
 * Priority: command line arguments > environment variables > properties file > defaults.
 * <p>
 * Invalid values are logged and the previous value is kept.
 */
@Getter
@Setter
@ToString
public class MiniKvConfig {

    private static final Logger log = LoggerFactory.getLogger(MiniKvConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "mini-kv.properties";

    // --- Server ---
    private String bind = "0.0.0.0";
    private int port = 6379;
    private int workerThreads = 0; // 0 = Netty default
    private int maxClients = 10000;
    private long shutdownTimeoutMs = 5000;

    // --- Protocol limits ---
    private long maxBulkLength = 512L * 1024 * 1024;
    private int maxMultibulkLength = 1024 * 1024;
    private int maxInlineLength = 64 * 1024;

    // --- Store ---
    private int lockStripes = 64;

    // --- Active expiration ---
    private int expireHz = 10;
    private int expireSampleSize = 20;

    private String configFilePath = DEFAULT_CONFIG_FILE;

    /**
     * Full load for the process entry point.
     */
    public static MiniKvConfig load(String[] args) {
        return load(args, System.getenv());
    }

    public static MiniKvConfig load(String[] args, Map<String, String> env) {
        MiniKvConfig config = new MiniKvConfig();
        config.configFilePath = findConfigPath(args);
        config.loadProperties(readProperties(config.configFilePath));
        config.applyEnvOverrides(env);
        config.parseArgs(args);
        log.info("MiniKvConfig initialized: {}", config);
        return config;
    }

    private static String findConfigPath(String[] args) {
        for (int i = 0; i + 1 < args.length; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return DEFAULT_CONFIG_FILE;
    }

    public void loadProperties(Properties props) {
        this.bind = props.getProperty("server.bind", this.bind).trim();
        this.port = getInt(props, "server.port", this.port);
        this.workerThreads = getInt(props, "server.worker_threads", this.workerThreads);
        this.maxClients = getInt(props, "server.max_clients", this.maxClients);
        this.shutdownTimeoutMs = getLong(props, "server.shutdown_timeout_ms", this.shutdownTimeoutMs);

        this.maxBulkLength = getLong(props, "proto.max_bulk_len", this.maxBulkLength);
        this.maxMultibulkLength = getInt(props, "proto.max_multibulk_len", this.maxMultibulkLength);
        this.maxInlineLength = getInt(props, "proto.max_inline_len", this.maxInlineLength);

        this.lockStripes = getInt(props, "store.lock_stripes", this.lockStripes);

        this.expireHz = getInt(props, "expire.hz", this.expireHz);
        this.expireSampleSize = getInt(props, "expire.sample_size", this.expireSampleSize);
    }

    void applyEnvOverrides(Map<String, String> env) {
        String envBind = env.get("MINIKV_BIND");
        if (envBind != null && !envBind.isBlank()) {
            this.bind = envBind.trim();
            log.info("Bind address overridden by ENV: {}", this.bind);
        }
        this.port = parseInt("MINIKV_PORT", env.get("MINIKV_PORT"), this.port);
        this.maxClients = parseInt("MINIKV_MAX_CLIENTS", env.get("MINIKV_MAX_CLIENTS"), this.maxClients);
    }

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            boolean hasValue = i + 1 < args.length;
            if ("--config".equals(arg) && hasValue) {
                i++; // handled before the file was read
            } else if ("--port".equals(arg) && hasValue) {
                this.port = parseInt(arg, args[++i], this.port);
            } else if ("--bind".equals(arg) && hasValue) {
                this.bind = args[++i];
            } else if ("--maxclients".equals(arg) && hasValue) {
                this.maxClients = parseInt(arg, args[++i], this.maxClients);
            } else {
                log.warn("Ignoring unknown argument: {}", arg);
            }
        }
    }

    static Properties readProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = MiniKvConfig.class.getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
                return props;
            }
        } catch (IOException e) {
            log.error("Error loading config from classpath: {}", path, e);
        }
        try (InputStream fis = new FileInputStream(path)) {
            props.load(fis);
            log.info("Loaded config from file: {}", path);
        } catch (IOException e) {
            log.warn("Config file not found: {}, using defaults.", path);
        }
        return props;
    }

    private static int getInt(Properties props, String key, int defaultValue) {
        return parseInt(key, props.getProperty(key), defaultValue);
    }

    private static long getLong(Properties props, String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value '{}' for {}, using {}.", val, key, defaultValue);
            return defaultValue;
        }
    }

    private static int parseInt(String key, String val, int defaultValue) {
        if (val == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value '{}' for {}, using {}.", val, key, defaultValue);
            return defaultValue;
        }
    }
}
