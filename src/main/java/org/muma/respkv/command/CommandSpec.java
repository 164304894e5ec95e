package org.muma.respkv.command;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Registry entry of one command.
 *
 * @param arity    positive: exact argument count including the command name;
 *                 negative: the minimum count
 * @param maxArity upper bound on the argument count for variadic commands, or {@code 0} when unbounded
 */
public record CommandSpec(String name, int arity, int maxArity, Set<CommandFlag> flags, CommandHandler handler) {

    public CommandSpec {
        flags = Collections.unmodifiableSet(flags.isEmpty() ? EnumSet.noneOf(CommandFlag.class) : EnumSet.copyOf(flags));
    }

    public CommandSpec(String name, int arity, Set<CommandFlag> flags, CommandHandler handler) {
        this(name, arity, 0, flags, handler);
    }

    /**
     * @param argc argument count including the command name
     */
    public boolean acceptsArgCount(int argc) {
        if (arity >= 0) {
            return argc == arity;
        }
        return argc >= -arity && (maxArity <= 0 || argc <= maxArity);
    }

    public boolean isWrite() {
        return flags.contains(CommandFlag.WRITE);
    }
}
