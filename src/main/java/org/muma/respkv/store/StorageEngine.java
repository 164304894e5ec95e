package org.muma.respkv.store;

import org.muma.respkv.common.Bytes;
import org.muma.respkv.common.KeyEntry;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.RedisValue;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * The shared keyspace.
 * <p>
 * Every method is atomic with respect to every other call touching the same key. Every access
 * first applies passive expiration: an entry past its expiry is removed and treated as absent
 * before the operation's own logic runs.
 * <p>
 * Callbacks passed in run while the key's lock is held; they must be short and must not block.
 */
public interface StorageEngine {

    // --- whole-entry primitives

    /**
     * Runs {@code operation} with exclusive access to {@code key}.
     */
    <R> R compute(Bytes key, Function<KeySlot, R> operation);

    /**
     * Replaces the value and clears any expiry.
     */
    void set(Bytes key, RedisValue value);

    boolean remove(Bytes key);

    boolean exists(Bytes key);

    /**
     * Variant held by the key, {@code null} when absent.
     */
    RedisDataType type(Bytes key);

    // --- typed primitives

    /**
     * Reads a value of the given variant. Absent keys yield {@code absent} without invoking the
     * reader.
     *
     * @throws WrongTypeException if the key holds another variant
     */
    <T extends RedisValue, R> R read(Bytes key, Class<T> type, Function<T, R> reader, R absent);

    /**
     * Mutates a value of the given variant, creating an empty one if the key is absent. A value
     * left empty by the mutator is removed from the keyspace.
     *
     * @throws WrongTypeException if the key holds another variant
     */
    <T extends RedisValue, R> R update(Bytes key, Class<T> type, Function<T, R> mutator);

    /**
     * Like {@link #update} but never creates the key; absent keys yield {@code absent}.
     */
    <T extends RedisValue, R> R updateExisting(Bytes key, Class<T> type, Function<T, R> mutator, R absent);

    // --- expiration

    /**
     * Sets an absolute expiry. A timestamp not in the future deletes the key at once.
     *
     * @return false when the key does not exist
     */
    boolean expireAt(Bytes key, long expireAtMillis);

    /**
     * @return false when the key does not exist or had no expiry
     */
    boolean persist(Bytes key);

    /**
     * @return -2 if absent, -1 if the key has no expiry, otherwise the absolute expiry in millis
     */
    long getExpireAt(Bytes key);

    /**
     * Active expiration step: removes the key only if, under its lock, its expiry has elapsed.
     */
    boolean expireIfElapsed(Bytes key);

    /**
     * Weakly consistent iterator over keys currently carrying an expiry.
     */
    Iterator<Bytes> volatileKeys();

    int volatileSize();

    // --- multi-key

    /**
     * Holds the locks of all {@code keys} while {@code action} runs. Locks are taken in one
     * global order, so two calls naming the same keys in different orders cannot deadlock.
     * Per-key methods called from inside {@code action} re-enter the held locks.
     */
    <R> R atomically(Collection<Bytes> keys, Supplier<R> action);

    // --- keyspace-wide

    List<Bytes> keys(Predicate<Bytes> filter);

    /**
     * Enumerates a copy of every live entry. Each entry is consistent on its own; the
     * enumeration as a whole is not a global point-in-time snapshot.
     */
    void forEachEntry(Consumer<KeyEntry> consumer);

    int size();

    void flush();

    long now();

    /**
     * Number of mutations since the last {@link #resetDirty()}.
     */
    long getDirty();

    void resetDirty();
}
