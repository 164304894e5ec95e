package org.muma.respkv.common;

import org.muma.respkv.store.structure.zset.RangeSpec;
import org.muma.respkv.store.structure.zset.ZSkipList;
import org.muma.respkv.store.structure.zset.ZSkipListNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sorted set value.
 * <p>
 * A member dictionary gives O(1) score lookups; the skip list keeps (score, member) order for
 * rank and range queries. Both are updated together on every mutation.
 */
public final class RedisZSet implements RedisValue {

    public record ZSetEntry(Bytes member, double score) {
    }

    private final Map<Bytes, Double> dict = new HashMap<>();
    private final ZSkipList zsl = new ZSkipList();

    @Override
    public RedisDataType type() {
        return RedisDataType.ZSET;
    }

    @Override
    public boolean isEmpty() {
        return dict.isEmpty();
    }

    @Override
    public RedisValue copy() {
        RedisZSet copy = new RedisZSet();
        for (ZSkipListNode node = zsl.first(); node != null; node = node.level[0].forward) {
            copy.add(node.score, node.member);
        }
        return copy;
    }

    /**
     * @return 1 if the member is new, 0 if it existed (its score may have changed)
     */
    public int add(double score, Bytes member) {
        Double current = dict.get(member);
        if (current != null) {
            if (current != score) {
                zsl.updateScore(current, member, score);
                dict.put(member, score);
            }
            return 0;
        }
        zsl.insert(score, member);
        dict.put(member, score);
        return 1;
    }

    /**
     * @throws RedisException if the sum is NaN (inf plus -inf); the set is left unchanged
     */
    public double incrBy(double increment, Bytes member) {
        Double old = dict.get(member);
        double value = (old == null ? 0 : old) + increment;
        if (Double.isNaN(value)) {
            throw new RedisException("ERR resulting score is not a number (NaN)");
        }
        add(value, member);
        return value;
    }

    public int remove(Bytes member) {
        Double score = dict.remove(member);
        if (score == null) {
            return 0;
        }
        return zsl.delete(score, member);
    }

    public Double getScore(Bytes member) {
        return dict.get(member);
    }

    /**
     * 0-based rank, {@code null} when the member is absent.
     */
    public Long getRank(Bytes member) {
        Double score = dict.get(member);
        if (score == null) return null;
        long rank = zsl.getRank(score, member);
        return rank == 0 ? null : rank - 1;
    }

    public int size() {
        return dict.size();
    }

    /**
     * Entries with rank in {@code [start, stop]}, negative indexes counting from the highest rank.
     */
    public List<ZSetEntry> range(long start, long stop) {
        long size = zsl.length();
        if (start < 0) start = size + start;
        if (stop < 0) stop = size + stop;
        if (start < 0) start = 0;
        if (start > stop || start >= size) return Collections.emptyList();
        if (stop >= size) stop = size - 1;

        ZSkipListNode node = zsl.getNodeByRank(start + 1);
        List<ZSetEntry> result = new ArrayList<>((int) (stop - start + 1));
        long count = stop - start + 1;
        while (count > 0 && node != null) {
            result.add(new ZSetEntry(node.member, node.score));
            node = node.level[0].forward;
            count--;
        }
        return result;
    }

    /**
     * Same indexes as {@link #range} but counted from the highest score down.
     */
    public List<ZSetEntry> revRange(long start, long stop) {
        long size = zsl.length();
        if (start < 0) start = size + start;
        if (stop < 0) stop = size + stop;
        if (start < 0) start = 0;
        if (start > stop || start >= size) return Collections.emptyList();
        if (stop >= size) stop = size - 1;

        List<ZSetEntry> list = new ArrayList<>(range(size - 1 - stop, size - 1 - start));
        Collections.reverse(list);
        return list;
    }

    /**
     * @param count maximum entries to return, negative for no limit
     */
    public List<ZSetEntry> rangeByScore(RangeSpec range, long offset, long count) {
        List<ZSetEntry> result = new ArrayList<>();
        ZSkipListNode node = zsl.firstInRange(range);
        while (offset > 0 && node != null) {
            node = node.level[0].forward;
            offset--;
        }
        while (node != null && count != 0 && range.lteMax(node.score)) {
            result.add(new ZSetEntry(node.member, node.score));
            node = node.level[0].forward;
            count--;
        }
        return result;
    }

    public long count(RangeSpec range) {
        long n = 0;
        for (ZSkipListNode node = zsl.firstInRange(range); node != null && range.lteMax(node.score);
             node = node.level[0].forward) {
            n++;
        }
        return n;
    }
}
