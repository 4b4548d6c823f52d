package org.muma.respkv.command;

import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.store.StorageEngine;

/**
 * 已校验的命令。
 * 只能由 {@link CommandParser} 构造，所以 execute 里不再做参数检查，也不会失败。
 */
public sealed interface RedisCommand permits PingCommand, GetCommand, SetCommand {

    // 执行命令，传入存储引擎，返回一个响应
    RedisMessage execute(StorageEngine storage);

    String name();

    // 默认不是写命令，SET 需要覆盖返回 true
    default boolean isWrite() {
        return false;
    }
}
