package org.muma.respkv.protocol;

// 1. 简单字符串 (+)，内容不能包含 \r\n
public record SimpleString(String content) implements RedisMessage {
}
