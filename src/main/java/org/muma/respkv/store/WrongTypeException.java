package org.muma.respkv.store;

import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.RedisException;

/**
 * A command addressed a key holding a different value variant than it operates on.
 */
public class WrongTypeException extends RedisException {

    public static final String MESSAGE = "WRONGTYPE Operation against a key holding the wrong kind of value";

    private final RedisDataType expected;
    private final RedisDataType actual;

    public WrongTypeException(RedisDataType expected, RedisDataType actual) {
        super(MESSAGE);
        this.expected = expected;
        this.actual = actual;
    }

    public RedisDataType getExpected() {
        return expected;
    }

    public RedisDataType getActual() {
        return actual;
    }
}
