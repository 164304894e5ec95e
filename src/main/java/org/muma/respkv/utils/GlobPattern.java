package org.muma.respkv.utils;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Redis style glob ({@code * ? [abc] [^a-z] \x}) compiled to a regex.
 * <p>
 * Matching runs over the ISO-8859-1 view of the raw bytes, so binary keys match byte by byte.
 */
public final class GlobPattern {

    private static final GlobPattern MATCH_ALL = new GlobPattern(null);

    private final Pattern regex;

    private GlobPattern(Pattern regex) {
        this.regex = regex;
    }

    public static GlobPattern compile(byte[] glob) {
        String pattern = new String(glob, StandardCharsets.ISO_8859_1);
        if ("*".equals(pattern)) {
            return MATCH_ALL;
        }
        return new GlobPattern(Pattern.compile(toRegex(pattern), Pattern.DOTALL));
    }

    public boolean matches(byte[] subject) {
        if (regex == null) {
            return true;
        }
        return regex.matcher(new String(subject, StandardCharsets.ISO_8859_1)).matches();
    }

    static String toRegex(String glob) {
        StringBuilder sb = new StringBuilder(glob.length() + 8);
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> sb.append(".*");
                case '?' -> sb.append('.');
                case '\\' -> {
                    if (i + 1 < n) {
                        i++;
                        sb.append(Pattern.quote(String.valueOf(glob.charAt(i))));
                    } else {
                        sb.append("\\\\");
                    }
                }
                case '[' -> {
                    int close = glob.indexOf(']', i + 1);
                    if (close < 0) {
                        // unterminated class is a literal '['
                        sb.append("\\[");
                    } else {
                        sb.append(toCharClass(glob.substring(i + 1, close)));
                        i = close;
                    }
                }
                default -> sb.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return sb.toString();
    }

    private static String toCharClass(String body) {
        StringBuilder sb = new StringBuilder("[");
        int i = 0;
        if (body.startsWith("^")) {
            sb.append('^');
            i = 1;
        }
        if (i == body.length()) {
            // "[]" and "[^]" never match / match anything
            return sb.length() == 1 ? "(?!)" : ".";
        }
        for (; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '-' && i > 0 && i < body.length() - 1 && sb.length() > 1) {
                sb.append('-');
            } else if (Character.isLetterOrDigit(c)) {
                sb.append(c);
            } else {
                sb.append('\\').append(c);
            }
        }
        return sb.append(']').toString();
    }
}
