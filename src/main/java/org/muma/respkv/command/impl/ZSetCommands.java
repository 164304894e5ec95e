package org.muma.respkv.command.impl;

import org.muma.respkv.common.Bytes;
import org.muma.respkv.common.RedisException;
import org.muma.respkv.common.RedisZSet;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.store.StorageEngine;
import org.muma.respkv.store.structure.zset.RangeSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.muma.respkv.command.CommandSupport.formatScore;
import static org.muma.respkv.command.CommandSupport.key;
import static org.muma.respkv.command.CommandSupport.option;
import static org.muma.respkv.command.CommandSupport.parseDouble;
import static org.muma.respkv.command.CommandSupport.parseLong;
import static org.muma.respkv.command.CommandSupport.str;
import static org.muma.respkv.command.CommandSupport.zsetReply;

/**
 * Sorted set commands. Every multi-member command validates all of its arguments before the
 * first mutation, so a bad score never leaves a half-applied ZADD behind.
 */
public final class ZSetCommands {

    private static final Logger log = LoggerFactory.getLogger(ZSetCommands.class);

    private static final int LARGE_RESULT = 10000;

    private ZSetCommands() {
    }

    /**
     * ZADD key [NX | XX] [CH] score member [score member ...]
     * <p>
     * O(K * log(N)) for K pairs. Replies with the number of new members, or with CH the number of
     * members added or re-scored.
     */
    public static RedisMessage zadd(StorageEngine storage, List<byte[]> args) {
        boolean nx = false;
        boolean xx = false;
        boolean ch = false;
        int i = 1;
        for (; i < args.size(); i++) {
            String opt = option(args.get(i));
            if ("NX".equals(opt)) {
                nx = true;
            } else if ("XX".equals(opt)) {
                xx = true;
            } else if ("CH".equals(opt)) {
                ch = true;
            } else {
                break;
            }
        }
        int pairs = args.size() - i;
        if (pairs == 0 || pairs % 2 != 0) {
            throw RedisException.syntax();
        }
        if (nx && xx) {
            throw new RedisException("ERR XX and NX options at the same time are not compatible");
        }

        int n = pairs / 2;
        double[] scores = new double[n];
        Bytes[] members = new Bytes[n];
        for (int p = 0; p < n; p++) {
            scores[p] = parseDouble(args.get(i + 2 * p));
            members[p] = Bytes.wrap(args.get(i + 2 * p + 1));
        }

        final boolean onlyNew = nx;
        final boolean onlyExisting = xx;
        final boolean countChanged = ch;
        int result = storage.update(key(args.get(0)), RedisZSet.class, zset -> {
            int added = 0;
            int changed = 0;
            for (int p = 0; p < n; p++) {
                Double current = zset.getScore(members[p]);
                if ((onlyNew && current != null) || (onlyExisting && current == null)) {
                    continue;
                }
                if (current == null) {
                    added += zset.add(scores[p], members[p]);
                } else if (current != scores[p]) {
                    zset.add(scores[p], members[p]);
                    changed++;
                }
            }
            return countChanged ? added + changed : added;
        });
        return new RedisInteger(result);
    }

    public static RedisMessage zincrby(StorageEngine storage, List<byte[]> args) {
        double increment = parseDouble(args.get(1));
        Bytes member = Bytes.wrap(args.get(2));
        double score = storage.update(key(args.get(0)), RedisZSet.class, zset -> zset.incrBy(increment, member));
        return new BulkString(formatScore(score));
    }

    public static RedisMessage zrange(StorageEngine storage, List<byte[]> args) {
        return rankRange(storage, args, false);
    }

    public static RedisMessage zrevrange(StorageEngine storage, List<byte[]> args) {
        return rankRange(storage, args, true);
    }

    private static RedisMessage rankRange(StorageEngine storage, List<byte[]> args, boolean reverse) {
        long start = parseLong(args.get(1));
        long stop = parseLong(args.get(2));
        boolean withScores = false;
        if (args.size() == 4) {
            if (!"WITHSCORES".equals(option(args.get(3)))) {
                throw RedisException.syntax();
            }
            withScores = true;
        } else if (args.size() > 4) {
            throw RedisException.syntax();
        }
        boolean scores = withScores;
        return storage.read(key(args.get(0)), RedisZSet.class, zset -> {
            List<RedisZSet.ZSetEntry> entries = reverse ? zset.revRange(start, stop) : zset.range(start, stop);
            return zsetReply(entries, scores);
        }, RedisArray.EMPTY);
    }

    /**
     * ZRANGEBYSCORE key min max [WITHSCORES] [LIMIT offset count]
     */
    public static RedisMessage zrangebyscore(StorageEngine storage, List<byte[]> args) {
        RangeSpec range = RangeSpec.parse(str(args.get(1)), str(args.get(2)));
        boolean withScores = false;
        long offset = 0;
        long count = -1;
        for (int i = 3; i < args.size(); i++) {
            String opt = option(args.get(i));
            if ("WITHSCORES".equals(opt)) {
                withScores = true;
            } else if ("LIMIT".equals(opt) && i + 2 < args.size()) {
                offset = parseLong(args.get(i + 1));
                count = parseLong(args.get(i + 2));
                i += 2;
            } else {
                throw RedisException.syntax();
            }
        }
        Bytes key = key(args.get(0));
        boolean scores = withScores;
        long skip = offset;
        long limit = count;
        return storage.read(key, RedisZSet.class, zset -> {
            // a negative offset yields nothing, a negative count means no limit
            if (skip < 0 || range.isEmpty()) {
                return RedisArray.EMPTY;
            }
            List<RedisZSet.ZSetEntry> entries = zset.rangeByScore(range, skip, limit);
            if (entries.size() > LARGE_RESULT) {
                log.warn("Large result: ZRANGEBYSCORE key={} returned {} items", key, entries.size());
            }
            return zsetReply(entries, scores);
        }, RedisArray.EMPTY);
    }

    public static RedisMessage zcount(StorageEngine storage, List<byte[]> args) {
        RangeSpec range = RangeSpec.parse(str(args.get(1)), str(args.get(2)));
        return storage.read(key(args.get(0)), RedisZSet.class,
                zset -> range.isEmpty() ? RedisInteger.ZERO : new RedisInteger(zset.count(range)), RedisInteger.ZERO);
    }

    public static RedisMessage zscore(StorageEngine storage, List<byte[]> args) {
        Bytes member = Bytes.wrap(args.get(1));
        return storage.read(key(args.get(0)), RedisZSet.class, zset -> {
            Double score = zset.getScore(member);
            return score == null ? BulkString.NULL : new BulkString(formatScore(score));
        }, BulkString.NULL);
    }

    public static RedisMessage zrem(StorageEngine storage, List<byte[]> args) {
        int removed = storage.updateExisting(key(args.get(0)), RedisZSet.class, zset -> {
            int n = 0;
            for (int i = 1; i < args.size(); i++) {
                n += zset.remove(Bytes.wrap(args.get(i)));
            }
            return n;
        }, 0);
        return new RedisInteger(removed);
    }

    public static RedisMessage zcard(StorageEngine storage, List<byte[]> args) {
        return storage.read(key(args.get(0)), RedisZSet.class,
                zset -> new RedisInteger(zset.size()), RedisInteger.ZERO);
    }

    public static RedisMessage zrank(StorageEngine storage, List<byte[]> args) {
        Bytes member = Bytes.wrap(args.get(1));
        return storage.read(key(args.get(0)), RedisZSet.class, zset -> {
            Long rank = zset.getRank(member);
            return rank == null ? BulkString.NULL : new RedisInteger(rank);
        }, BulkString.NULL);
    }
}
