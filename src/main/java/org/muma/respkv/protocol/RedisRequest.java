package org.muma.respkv.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * One decoded client request: argument 0 is the command name, the rest are its arguments.
 * Both the multi-bulk and the inline form decode to this shape.
 */
public record RedisRequest(List<byte[]> parts) {

    public static final RedisRequest EMPTY = new RedisRequest(Collections.emptyList());

    public RedisRequest {
        parts = Collections.unmodifiableList(parts);
    }

    public static RedisRequest of(String... parts) {
        return new RedisRequest(Arrays.stream(parts)
                .map(p -> p.getBytes(StandardCharsets.UTF_8))
                .collect(Collectors.toList()));
    }

    public boolean isEmpty() {
        return parts.isEmpty();
    }

    /**
     * Command name as sent by the client (case preserved, used in error replies).
     */
    public String rawName() {
        return parts.isEmpty() ? "" : new String(parts.get(0), StandardCharsets.UTF_8);
    }

    public String name() {
        return rawName().toUpperCase(Locale.ROOT);
    }

    /**
     * Arguments after the command name.
     */
    public List<byte[]> args() {
        return parts.isEmpty() ? parts : parts.subList(1, parts.size());
    }

    public int size() {
        return parts.size();
    }

    @Override
    public String toString() {
        return parts.stream()
                .map(p -> new String(p, StandardCharsets.UTF_8))
                .collect(Collectors.joining(" ", "RedisRequest[", "]"));
    }
}
