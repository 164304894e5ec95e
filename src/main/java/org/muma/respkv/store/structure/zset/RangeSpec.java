package org.muma.respkv.store.structure.zset;

import org.muma.respkv.command.CommandSupport;
import org.muma.respkv.common.RedisException;

import java.nio.charset.StandardCharsets;

/**
 * Score interval for ZRANGEBYSCORE / ZCOUNT. A leading '(' makes a bound exclusive.
 */
public class RangeSpec {

    public final double min, max;
    public final boolean minex, maxex;

    public RangeSpec(double min, double max, boolean minex, boolean maxex) {
        this.min = min;
        this.max = max;
        this.minex = minex;
        this.maxex = maxex;
    }

    public boolean contains(double score) {
        return gteMin(score) && lteMax(score);
    }

    public boolean gteMin(double score) {
        return minex ? score > min : score >= min;
    }

    public boolean lteMax(double score) {
        return maxex ? score < max : score <= max;
    }

    public boolean isEmpty() {
        return min > max || (min == max && (minex || maxex));
    }

    public static RangeSpec parse(String minStr, String maxStr) {
        boolean minex = minStr.startsWith("(");
        boolean maxex = maxStr.startsWith("(");
        double min = parseBound(minex ? minStr.substring(1) : minStr);
        double max = parseBound(maxex ? maxStr.substring(1) : maxStr);
        return new RangeSpec(min, max, minex, maxex);
    }

    private static double parseBound(String s) {
        try {
            return CommandSupport.parseDouble(s.getBytes(StandardCharsets.UTF_8));
        } catch (RedisException e) {
            throw new RedisException("ERR min or max is not a float");
        }
    }
}
