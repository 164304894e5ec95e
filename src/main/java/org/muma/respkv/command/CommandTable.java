package org.muma.respkv.command;

import org.muma.respkv.command.impl.HashCommands;
import org.muma.respkv.command.impl.KeyCommands;
import org.muma.respkv.command.impl.ListCommands;
import org.muma.respkv.command.impl.ServerCommands;
import org.muma.respkv.command.impl.SetCommands;
import org.muma.respkv.command.impl.StringCommands;
import org.muma.respkv.command.impl.ZSetCommands;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static org.muma.respkv.command.CommandFlag.FAST;
import static org.muma.respkv.command.CommandFlag.READONLY;
import static org.muma.respkv.command.CommandFlag.WRITE;

/**
 * The static command registry, built once at class load and read-only afterwards.
 */
public final class CommandTable {

    private static final Map<String, CommandSpec> COMMANDS;

    static {
        Map<String, CommandSpec> table = new HashMap<>();
        registerServerCommands(table);
        registerKeyCommands(table);
        registerStringCommands(table);
        registerListCommands(table);
        registerHashCommands(table);
        registerSetCommands(table);
        registerZSetCommands(table);
        COMMANDS = Collections.unmodifiableMap(table);
    }

    private CommandTable() {
    }

    /**
     * @param name command name in any case
     * @return the command, or {@code null} if unknown
     */
    public static CommandSpec lookup(String name) {
        return COMMANDS.get(name.toUpperCase(Locale.ROOT));
    }

    public static int size() {
        return COMMANDS.size();
    }

    public static Map<String, CommandSpec> all() {
        return COMMANDS;
    }

    private static void registerServerCommands(Map<String, CommandSpec> t) {
        add(t, "PING", -1, 2, EnumSet.of(FAST), ServerCommands::ping);
        add(t, "ECHO", 2, EnumSet.of(FAST), ServerCommands::echo);
        add(t, "QUIT", -1, EnumSet.of(FAST), ServerCommands::quit);
        add(t, "DBSIZE", 1, EnumSet.of(READONLY, FAST), ServerCommands::dbsize);
        add(t, "FLUSHDB", -1, EnumSet.of(WRITE), ServerCommands::flushdb);
        add(t, "COMMAND", -1, EnumSet.noneOf(CommandFlag.class), ServerCommands::command);
    }

    private static void registerKeyCommands(Map<String, CommandSpec> t) {
        add(t, "DEL", -2, EnumSet.of(WRITE), KeyCommands::del);
        add(t, "EXISTS", -2, EnumSet.of(READONLY, FAST), KeyCommands::exists);
        add(t, "EXPIRE", 3, EnumSet.of(WRITE, FAST), KeyCommands::expire);
        add(t, "PEXPIRE", 3, EnumSet.of(WRITE, FAST), KeyCommands::pexpire);
        add(t, "EXPIREAT", 3, EnumSet.of(WRITE, FAST), KeyCommands::expireAt);
        add(t, "TTL", 2, EnumSet.of(READONLY, FAST), KeyCommands::ttl);
        add(t, "PTTL", 2, EnumSet.of(READONLY, FAST), KeyCommands::pttl);
        add(t, "PERSIST", 2, EnumSet.of(WRITE, FAST), KeyCommands::persist);
        add(t, "TYPE", 2, EnumSet.of(READONLY, FAST), KeyCommands::type);
        add(t, "KEYS", 2, EnumSet.of(READONLY), KeyCommands::keys);
    }

    private static void registerStringCommands(Map<String, CommandSpec> t) {
        add(t, "GET", 2, EnumSet.of(READONLY, FAST), StringCommands::get);
        add(t, "SET", -3, EnumSet.of(WRITE), StringCommands::set);
        add(t, "SETNX", 3, EnumSet.of(WRITE, FAST), StringCommands::setnx);
        add(t, "MGET", -2, EnumSet.of(READONLY, FAST), StringCommands::mget);
        add(t, "MSET", -3, EnumSet.of(WRITE), StringCommands::mset);
        add(t, "INCR", 2, EnumSet.of(WRITE, FAST), StringCommands::incr);
        add(t, "DECR", 2, EnumSet.of(WRITE, FAST), StringCommands::decr);
        add(t, "INCRBY", 3, EnumSet.of(WRITE, FAST), StringCommands::incrby);
        add(t, "DECRBY", 3, EnumSet.of(WRITE, FAST), StringCommands::decrby);
        add(t, "APPEND", 3, EnumSet.of(WRITE, FAST), StringCommands::append);
        add(t, "STRLEN", 2, EnumSet.of(READONLY, FAST), StringCommands::strlen);
    }

    private static void registerListCommands(Map<String, CommandSpec> t) {
        add(t, "LPUSH", -3, EnumSet.of(WRITE, FAST), ListCommands::lpush);
        add(t, "RPUSH", -3, EnumSet.of(WRITE, FAST), ListCommands::rpush);
        add(t, "LPOP", -2, 3, EnumSet.of(WRITE, FAST), ListCommands::lpop);
        add(t, "RPOP", -2, 3, EnumSet.of(WRITE, FAST), ListCommands::rpop);
        add(t, "LRANGE", 4, EnumSet.of(READONLY), ListCommands::lrange);
        add(t, "LLEN", 2, EnumSet.of(READONLY, FAST), ListCommands::llen);
        add(t, "LINDEX", 3, EnumSet.of(READONLY), ListCommands::lindex);
    }

    private static void registerHashCommands(Map<String, CommandSpec> t) {
        add(t, "HSET", -4, EnumSet.of(WRITE, FAST), HashCommands::hset);
        add(t, "HGET", 3, EnumSet.of(READONLY, FAST), HashCommands::hget);
        add(t, "HDEL", -3, EnumSet.of(WRITE, FAST), HashCommands::hdel);
        add(t, "HGETALL", 2, EnumSet.of(READONLY), HashCommands::hgetall);
        add(t, "HLEN", 2, EnumSet.of(READONLY, FAST), HashCommands::hlen);
        add(t, "HEXISTS", 3, EnumSet.of(READONLY, FAST), HashCommands::hexists);
        add(t, "HINCRBY", 4, EnumSet.of(WRITE, FAST), HashCommands::hincrby);
    }

    private static void registerSetCommands(Map<String, CommandSpec> t) {
        add(t, "SADD", -3, EnumSet.of(WRITE, FAST), SetCommands::sadd);
        add(t, "SREM", -3, EnumSet.of(WRITE, FAST), SetCommands::srem);
        add(t, "SMEMBERS", 2, EnumSet.of(READONLY), SetCommands::smembers);
        add(t, "SISMEMBER", 3, EnumSet.of(READONLY, FAST), SetCommands::sismember);
        add(t, "SCARD", 2, EnumSet.of(READONLY, FAST), SetCommands::scard);
    }

    private static void registerZSetCommands(Map<String, CommandSpec> t) {
        add(t, "ZADD", -4, EnumSet.of(WRITE, FAST), ZSetCommands::zadd);
        add(t, "ZINCRBY", 4, EnumSet.of(WRITE, FAST), ZSetCommands::zincrby);
        add(t, "ZRANGE", -4, EnumSet.of(READONLY), ZSetCommands::zrange);
        add(t, "ZREVRANGE", -4, EnumSet.of(READONLY), ZSetCommands::zrevrange);
        add(t, "ZRANGEBYSCORE", -4, EnumSet.of(READONLY), ZSetCommands::zrangebyscore);
        add(t, "ZCOUNT", 4, EnumSet.of(READONLY, FAST), ZSetCommands::zcount);
        add(t, "ZSCORE", 3, EnumSet.of(READONLY, FAST), ZSetCommands::zscore);
        add(t, "ZREM", -3, EnumSet.of(WRITE, FAST), ZSetCommands::zrem);
        add(t, "ZCARD", 2, EnumSet.of(READONLY, FAST), ZSetCommands::zcard);
        add(t, "ZRANK", 3, EnumSet.of(READONLY, FAST), ZSetCommands::zrank);
    }

    private static void add(Map<String, CommandSpec> table, String name, int arity,
                            Set<CommandFlag> flags, CommandHandler handler) {
        table.put(name, new CommandSpec(name, arity, flags, handler));
    }

    private static void add(Map<String, CommandSpec> table, String name, int arity, int maxArity,
                            Set<CommandFlag> flags, CommandHandler handler) {
        table.put(name, new CommandSpec(name, arity, maxArity, flags, handler));
    }
}
