package org.muma.respkv.protocol;

// 2. 错误 (-)，约定以错误类别开头，例如 "ERR ..."
public record ErrorMessage(String content) implements RedisMessage {
}
