package org.muma.respkv.command;

public enum CommandFlag {
    /** May modify the keyspace. */
    WRITE,
    READONLY,
    /** O(1) or O(log n). */
    FAST
}
