package org.muma.respkv.store.impl;

import org.muma.respkv.common.Bytes;
import org.muma.respkv.common.KeyEntry;
import org.muma.respkv.common.RedisData;
import org.muma.respkv.common.RedisDataType;
import org.muma.respkv.common.RedisValue;
import org.muma.respkv.store.KeySlot;
import org.muma.respkv.store.StorageEngine;
import org.muma.respkv.store.WrongTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * In-memory keyspace guarded by lock striping.
 * <p>
 * Keys hash onto a fixed power-of-two array of {@link ReentrantLock}s; every operation on a key
 * runs under its stripe, so unrelated keys on different stripes never serialize. The maps
 * themselves are concurrent only so that enumeration (snapshot, KEYS, the reaper) can iterate
 * without holding any lock; all reads and writes of an entry happen under its stripe.
 */
public class MemoryStorageEngine implements StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageEngine.class);

    public static final int DEFAULT_STRIPES = 64;

    // key -> entry
    private final Map<Bytes, RedisData> memoryDb = new ConcurrentHashMap<>();

    // key -> expireAt, only for keys with an expiry; the reaper samples from here
    private final Map<Bytes, Long> ttlMap = new ConcurrentHashMap<>();

    private final ReentrantLock[] stripes;
    private final int mask;
    private final Clock clock;
    private final LongAdder dirty = new LongAdder();

    public MemoryStorageEngine() {
        this(DEFAULT_STRIPES, Clock.systemUTC());
    }

    public MemoryStorageEngine(int stripeCount, Clock clock) {
        int n = 1;
        while (n < Math.max(1, stripeCount)) {
            n <<= 1;
        }
        this.stripes = new ReentrantLock[n];
        for (int i = 0; i < n; i++) {
            stripes[i] = new ReentrantLock();
        }
        this.mask = n - 1;
        this.clock = clock;
        log.debug("MemoryStorageEngine created with {} lock stripes", n);
    }

    // ------------------------------------------------------------------ locking

    private int stripeOf(Bytes key) {
        int h = key.hashCode();
        return (h ^ (h >>> 16)) & mask;
    }

    private ReentrantLock lockFor(Bytes key) {
        ReentrantLock lock = stripes[stripeOf(key)];
        lock.lock();
        return lock;
    }

    /**
     * Live entry for {@code key}; removes it first if it has expired. Caller holds the stripe.
     */
    private RedisData resolve(Bytes key) {
        RedisData data = memoryDb.get(key);
        if (data == null) {
            return null;
        }
        if (data.isExpired(clock.millis())) {
            removeInternal(key);
            return null;
        }
        return data;
    }

    private void putInternal(Bytes key, RedisData data) {
        memoryDb.put(key, data);
        if (data.hasExpire()) {
            ttlMap.put(key, data.getExpireAt());
        } else {
            ttlMap.remove(key);
        }
        dirty.increment();
    }

    private boolean removeInternal(Bytes key) {
        ttlMap.remove(key);
        boolean removed = memoryDb.remove(key) != null;
        if (removed) {
            dirty.increment();
        }
        return removed;
    }

    private static <T extends RedisValue> T checkType(RedisData data, Class<T> type) {
        RedisValue value = data.getValue();
        if (!type.isInstance(value)) {
            throw new WrongTypeException(RedisDataType.of(type), value.type());
        }
        return type.cast(value);
    }

    // ------------------------------------------------------------------ whole-entry

    @Override
    public <R> R compute(Bytes key, Function<KeySlot, R> operation) {
        ReentrantLock lock = lockFor(key);
        try {
            return operation.apply(new LockedSlot(key));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(Bytes key, RedisValue value) {
        ReentrantLock lock = lockFor(key);
        try {
            putInternal(key, new RedisData(value));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean remove(Bytes key) {
        ReentrantLock lock = lockFor(key);
        try {
            // an expired entry counts as already gone
            return resolve(key) != null && removeInternal(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean exists(Bytes key) {
        ReentrantLock lock = lockFor(key);
        try {
            return resolve(key) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RedisDataType type(Bytes key) {
        ReentrantLock lock = lockFor(key);
        try {
            RedisData data = resolve(key);
            return data == null ? null : data.getType();
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------ typed

    @Override
    public <T extends RedisValue, R> R read(Bytes key, Class<T> type, Function<T, R> reader, R absent) {
        ReentrantLock lock = lockFor(key);
        try {
            RedisData data = resolve(key);
            if (data == null) {
                return absent;
            }
            return reader.apply(checkType(data, type));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T extends RedisValue, R> R update(Bytes key, Class<T> type, Function<T, R> mutator) {
        ReentrantLock lock = lockFor(key);
        try {
            RedisData data = resolve(key);
            if (data == null) {
                T value = type.cast(RedisValue.empty(RedisDataType.of(type)));
                R result = mutator.apply(value);
                if (!value.isEmpty()) {
                    putInternal(key, new RedisData(value));
                }
                return result;
            }
            return mutateExisting(key, data, type, mutator);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T extends RedisValue, R> R updateExisting(Bytes key, Class<T> type, Function<T, R> mutator, R absent) {
        ReentrantLock lock = lockFor(key);
        try {
            RedisData data = resolve(key);
            if (data == null) {
                return absent;
            }
            return mutateExisting(key, data, type, mutator);
        } finally {
            lock.unlock();
        }
    }

    private <T extends RedisValue, R> R mutateExisting(Bytes key, RedisData data, Class<T> type, Function<T, R> mutator) {
        T value = checkType(data, type);
        R result = mutator.apply(value);
        if (value.isEmpty()) {
            removeInternal(key);
        } else {
            dirty.increment();
        }
        return result;
    }

    // ------------------------------------------------------------------ expiration

    @Override
    public boolean expireAt(Bytes key, long expireAtMillis) {
        ReentrantLock lock = lockFor(key);
        try {
            RedisData data = resolve(key);
            if (data == null) {
                return false;
            }
            if (expireAtMillis <= clock.millis()) {
                removeInternal(key);
                return true;
            }
            data.setExpireAt(expireAtMillis);
            ttlMap.put(key, expireAtMillis);
            dirty.increment();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean persist(Bytes key) {
        ReentrantLock lock = lockFor(key);
        try {
            RedisData data = resolve(key);
            if (data == null || !data.hasExpire()) {
                return false;
            }
            data.setExpireAt(RedisData.NO_EXPIRE);
            ttlMap.remove(key);
            dirty.increment();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long getExpireAt(Bytes key) {
        ReentrantLock lock = lockFor(key);
        try {
            RedisData data = resolve(key);
            if (data == null) {
                return -2;
            }
            return data.getExpireAt();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean expireIfElapsed(Bytes key) {
        ReentrantLock lock = lockFor(key);
        try {
            RedisData data = memoryDb.get(key);
            if (data == null) {
                // stale index entry
                ttlMap.remove(key);
                return false;
            }
            if (data.isExpired(clock.millis())) {
                return removeInternal(key);
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Iterator<Bytes> volatileKeys() {
        return ttlMap.keySet().iterator();
    }

    @Override
    public int volatileSize() {
        return ttlMap.size();
    }

    // ------------------------------------------------------------------ multi-key

    @Override
    public <R> R atomically(Collection<Bytes> keys, Supplier<R> action) {
        // ascending stripe order is the global lock order
        TreeSet<Integer> order = new TreeSet<>();
        for (Bytes key : keys) {
            order.add(stripeOf(key));
        }
        List<ReentrantLock> held = new ArrayList<>(order.size());
        try {
            for (int index : order) {
                ReentrantLock lock = stripes[index];
                lock.lock();
                held.add(lock);
            }
            return action.get();
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
        }
    }

    private void lockAll() {
        for (ReentrantLock lock : stripes) {
            lock.lock();
        }
    }

    private void unlockAll() {
        for (int i = stripes.length - 1; i >= 0; i--) {
            stripes[i].unlock();
        }
    }

    // ------------------------------------------------------------------ keyspace-wide

    @Override
    public List<Bytes> keys(Predicate<Bytes> filter) {
        List<Bytes> result = new ArrayList<>();
        for (Bytes key : memoryDb.keySet()) {
            if (filter.test(key) && exists(key)) {
                result.add(key);
            }
        }
        return result;
    }

    @Override
    public void forEachEntry(Consumer<KeyEntry> consumer) {
        for (Bytes key : memoryDb.keySet()) {
            KeyEntry entry;
            ReentrantLock lock = lockFor(key);
            try {
                RedisData data = resolve(key);
                if (data == null) {
                    continue;
                }
                entry = new KeyEntry(key, data.getValue().copy(), data.getExpireAt());
            } finally {
                lock.unlock();
            }
            consumer.accept(entry);
        }
    }

    @Override
    public int size() {
        return memoryDb.size();
    }

    @Override
    public void flush() {
        lockAll();
        try {
            int removed = memoryDb.size();
            memoryDb.clear();
            ttlMap.clear();
            dirty.add(removed);
            log.info("Keyspace flushed, {} keys removed", removed);
        } finally {
            unlockAll();
        }
    }

    @Override
    public long now() {
        return clock.millis();
    }

    @Override
    public long getDirty() {
        return dirty.sum();
    }

    @Override
    public void resetDirty() {
        dirty.reset();
    }

    // ------------------------------------------------------------------

    private class LockedSlot implements KeySlot {

        private final Bytes key;

        LockedSlot(Bytes key) {
            this.key = key;
        }

        @Override
        public RedisData get() {
            return resolve(key);
        }

        @Override
        public void set(RedisValue value, long expireAt) {
            putInternal(key, new RedisData(value, expireAt));
        }

        @Override
        public boolean remove() {
            return resolve(key) != null && removeInternal(key);
        }
    }
}
