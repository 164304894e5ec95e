package org.muma.respkv.protocol;

// -ERR ...
public record ErrorMessage(String content) implements RedisMessage {
}
