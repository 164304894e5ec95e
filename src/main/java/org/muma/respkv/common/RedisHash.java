package org.muma.respkv.common;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Hash value: field to value mapping with unique fields.
 */
public final class RedisHash implements RedisValue {

    private final Map<Bytes, byte[]> fields;

    public RedisHash() {
        this.fields = new HashMap<>();
    }

    private RedisHash(Map<Bytes, byte[]> fields) {
        this.fields = fields;
    }

    @Override
    public RedisDataType type() {
        return RedisDataType.HASH;
    }

    @Override
    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public RedisValue copy() {
        return new RedisHash(new HashMap<>(fields));
    }

    /**
     * @return 1 if the field is new, 0 if an existing value was overwritten
     */
    public int put(Bytes field, byte[] value) {
        return fields.put(field, value) == null ? 1 : 0;
    }

    public byte[] get(Bytes field) {
        return fields.get(field);
    }

    public int remove(Bytes field) {
        return fields.remove(field) != null ? 1 : 0;
    }

    public boolean contains(Bytes field) {
        return fields.containsKey(field);
    }

    public int size() {
        return fields.size();
    }

    public Map<Bytes, byte[]> entries() {
        return Collections.unmodifiableMap(fields);
    }
}
