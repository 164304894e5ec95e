package org.muma.respkv.command;

import org.muma.respkv.common.Bytes;
import org.muma.respkv.common.RedisException;
import org.muma.respkv.common.RedisZSet;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Argument parsing and reply building shared by the command groups.
 */
public final class CommandSupport {

    private CommandSupport() {
    }

    public static Bytes key(byte[] arg) {
        return Bytes.wrap(arg);
    }

    public static List<Bytes> toKeys(List<byte[]> args, int from) {
        List<Bytes> keys = new ArrayList<>(args.size() - from);
        for (int i = from; i < args.size(); i++) {
            keys.add(Bytes.wrap(args.get(i)));
        }
        return keys;
    }

    public static String str(byte[] arg) {
        return new String(arg, StandardCharsets.UTF_8);
    }

    /**
     * Upper-cased option keyword such as NX, WITHSCORES.
     */
    public static String option(byte[] arg) {
        return str(arg).toUpperCase(Locale.ROOT);
    }

    public static RedisException wrongArgs(String command) {
        return new RedisException("ERR wrong number of arguments for '" + command.toLowerCase(Locale.ROOT) + "' command");
    }

    /**
     * Strict signed 64-bit decimal: no sign other than a leading '-', no whitespace, no overflow.
     */
    public static long parseLong(byte[] arg) {
        long value = parseLongOrMin(arg);
        if (value == Long.MIN_VALUE && !"-9223372036854775808".equals(str(arg))) {
            throw RedisException.notInteger();
        }
        return value;
    }

    private static long parseLongOrMin(byte[] arg) {
        int len = arg.length;
        if (len == 0 || len > 20) {
            return Long.MIN_VALUE;
        }
        int i = 0;
        boolean negative = false;
        if (arg[0] == '-') {
            negative = true;
            i = 1;
            if (len == 1) {
                return Long.MIN_VALUE;
            }
        }
        // "0" is fine, "01" is not
        if (arg[i] == '0' && len > i + 1) {
            return Long.MIN_VALUE;
        }
        long limit = negative ? Long.MIN_VALUE : -Long.MAX_VALUE;
        long result = 0;
        // accumulate negatively so that Long.MIN_VALUE fits
        for (; i < len; i++) {
            int digit = arg[i] - '0';
            if (digit < 0 || digit > 9) {
                return Long.MIN_VALUE;
            }
            if (result < (limit + digit) / 10) {
                return Long.MIN_VALUE;
            }
            result = result * 10 - digit;
        }
        return negative ? result : -result;
    }

    /**
     * Score style float: decimal or exponent notation, or inf / +inf / -inf. NaN is rejected, and so
     * is a literal too large for a double.
     */
    public static double parseDouble(byte[] arg) {
        String s = str(arg);
        if (s.isEmpty() || Character.isWhitespace(s.charAt(0)) || Character.isWhitespace(s.charAt(s.length() - 1))) {
            throw RedisException.notFloat();
        }
        switch (s.toLowerCase(Locale.ROOT)) {
            case "inf", "+inf":
                return Double.POSITIVE_INFINITY;
            case "-inf":
                return Double.NEGATIVE_INFINITY;
            default:
                break;
        }
        // Double.parseDouble also takes hex literals, type suffixes and "Infinity"
        char last = s.charAt(s.length() - 1);
        if (!Character.isDigit(last) && last != '.') {
            throw RedisException.notFloat();
        }
        if (s.indexOf('x') >= 0 || s.indexOf('X') >= 0) {
            throw RedisException.notFloat();
        }
        double value;
        try {
            value = Double.parseDouble(s);
        } catch (NumberFormatException e) {
            throw RedisException.notFloat();
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw RedisException.notFloat();
        }
        return value;
    }

    public static long addExact(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new RedisException(RedisException.ERR_OVERFLOW);
        }
    }

    /**
     * Integral scores print without a fraction ("3" not "3.0"); infinities as inf / -inf.
     */
    public static String formatScore(double score) {
        if (Double.isInfinite(score)) {
            return score > 0 ? "inf" : "-inf";
        }
        if (score == Math.rint(score) && Math.abs(score) < 1e17) {
            return Long.toString((long) score);
        }
        String s = Double.toString(score);
        int e = s.indexOf('E');
        if (e < 0) {
            return s;
        }
        // 1.0E-5 -> 1.0e-5, 1.0E20 -> 1.0e+20
        String exponent = s.substring(e + 1);
        return s.substring(0, e) + "e" + (exponent.startsWith("-") ? exponent : "+" + exponent);
    }

    public static BulkString bulk(byte[] value) {
        return value == null ? BulkString.NULL : new BulkString(value);
    }

    public static RedisMessage zsetReply(List<RedisZSet.ZSetEntry> entries, boolean withScores) {
        RedisMessage[] result = new RedisMessage[entries.size() * (withScores ? 2 : 1)];
        int i = 0;
        for (RedisZSet.ZSetEntry entry : entries) {
            result[i++] = new BulkString(entry.member().array());
            if (withScores) {
                result[i++] = new BulkString(formatScore(entry.score()));
            }
        }
        return new RedisArray(result);
    }

    public static RedisArray bytesReply(List<Bytes> values) {
        RedisMessage[] result = new RedisMessage[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = new BulkString(values.get(i).array());
        }
        return new RedisArray(result);
    }
}
