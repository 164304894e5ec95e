package org.muma.respkv.common;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * List value: a deque of byte strings, O(1) at both ends.
 * Not thread-safe; the store only touches it under the owning key's lock.
 */
public final class RedisList implements RedisValue {

    private final Deque<byte[]> elements;

    public RedisList() {
        this.elements = new ArrayDeque<>();
    }

    private RedisList(Deque<byte[]> elements) {
        this.elements = elements;
    }

    @Override
    public RedisDataType type() {
        return RedisDataType.LIST;
    }

    @Override
    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public RedisValue copy() {
        return new RedisList(new ArrayDeque<>(elements));
    }

    // LPUSH a b c -> c b a
    public void lpush(byte[] element) {
        elements.addFirst(element);
    }

    public void rpush(byte[] element) {
        elements.addLast(element);
    }

    public byte[] lpop() {
        return elements.pollFirst();
    }

    public byte[] rpop() {
        return elements.pollLast();
    }

    public int size() {
        return elements.size();
    }

    /**
     * Elements in {@code [start, stop]}, both inclusive, negative indexes counting from the tail.
     */
    public List<byte[]> range(long start, long stop) {
        int size = elements.size();
        if (start < 0) start = size + start;
        if (stop < 0) stop = size + stop;
        if (start < 0) start = 0;
        if (start > stop || start >= size) {
            return Collections.emptyList();
        }
        if (stop >= size) stop = size - 1;

        List<byte[]> result = new ArrayList<>((int) (stop - start + 1));
        Iterator<byte[]> it = elements.iterator();
        for (long i = 0; i <= stop && it.hasNext(); i++) {
            byte[] element = it.next();
            if (i >= start) {
                result.add(element);
            }
        }
        return result;
    }

    /**
     * LINDEX semantics, {@code null} when out of range.
     */
    public byte[] index(long index) {
        int size = elements.size();
        if (index < 0) index = size + index;
        if (index < 0 || index >= size) {
            return null;
        }
        // walk from the nearer end
        if (index < size / 2) {
            Iterator<byte[]> it = elements.iterator();
            for (long i = 0; i < index; i++) it.next();
            return it.next();
        }
        Iterator<byte[]> it = elements.descendingIterator();
        for (long i = size - 1; i > index; i--) it.next();
        return it.next();
    }
}
