package org.muma.respkv.command;

import org.muma.respkv.protocol.ErrorMessage;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 解析 + 执行。所有连接共用一个实例，共享同一个 StorageEngine。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private static final long SLOW_COMMAND_MILLIS = 10;

    private final CommandParser parser;
    private final StorageEngine storage;

    public CommandDispatcher(StorageEngine storage) {
        this(new CommandParser(), storage);
    }

    public CommandDispatcher(CommandParser parser, StorageEngine storage) {
        this.parser = parser;
        this.storage = storage;
        log.info("CommandDispatcher initialized. Total commands registered: {}", parser.commandNames().size());
    }

    /**
     * 核心分发逻辑：解析失败返回 ERR 响应，不会抛异常
     */
    public RedisMessage dispatch(RedisMessage frame) {
        // 1. 解析命令
        RedisCommand command;
        try {
            command = parser.parse(frame);
        } catch (CommandParseException e) {
            log.warn("Command rejected (Client Error): {}", e.getMessage());
            return new ErrorMessage("ERR " + e.getMessage());
        }

        // 2. 执行并监控耗时
        long startTime = System.nanoTime();
        RedisMessage response = command.execute(storage);

        long duration = (System.nanoTime() - startTime) / 1000_000; // ms
        if (duration > SLOW_COMMAND_MILLIS) {
            log.warn("Slow command detected: {} cost {}ms", command.name(), duration);
        } else if (log.isDebugEnabled()) {
            log.debug("Command executed: {} write={} cost {}ms", command.name(), command.isWrite(), duration);
        }
        return response;
    }

    public StorageEngine getStorage() {
        return storage;
    }
}
