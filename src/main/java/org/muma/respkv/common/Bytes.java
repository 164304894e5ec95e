package org.muma.respkv.common;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Immutable binary-safe string used for keys, hash fields, set and sorted-set members.
 * Equality is by content; ordering is unsigned lexicographic, which is the byte order Redis uses
 * to break sorted-set score ties.
 */
public final class Bytes implements Comparable<Bytes> {

    private final byte[] data;
    private int hash;

    private Bytes(byte[] data) {
        this.data = data;
    }

    /**
     * Wraps without copying. The caller hands over ownership of the array.
     */
    public static Bytes wrap(byte[] data) {
        return new Bytes(data);
    }

    public static Bytes of(String s) {
        return new Bytes(s.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * The backing array. Callers must not modify it.
     */
    public byte[] array() {
        return data;
    }

    public int length() {
        return data.length;
    }

    @Override
    public int compareTo(Bytes o) {
        return Arrays.compareUnsigned(data, o.data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bytes other)) return false;
        return Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Arrays.hashCode(data);
            hash = h;
        }
        return h;
    }

    @Override
    public String toString() {
        return new String(data, StandardCharsets.UTF_8);
    }
}
