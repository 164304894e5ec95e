package org.muma.respkv.store;

import org.muma.respkv.common.RedisData;
import org.muma.respkv.common.RedisValue;

/**
 * Access to a single key while its lock is held. Only valid inside the
 * {@link StorageEngine#compute} callback that received it.
 */
public interface KeySlot {

    /**
     * The live entry, or {@code null} if the key is absent or already expired.
     */
    RedisData get();

    /**
     * Replaces the whole entry.
     *
     * @param expireAt absolute expiry in epoch millis, or {@link RedisData#NO_EXPIRE}
     */
    void set(RedisValue value, long expireAt);

    boolean remove();
}
