package org.muma.respkv.command;

import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;
import org.muma.respkv.store.StorageEngine;

public record PingCommand() implements RedisCommand {

    private static final SimpleString PONG = new SimpleString("PONG");

    @Override
    public RedisMessage execute(StorageEngine storage) {
        return PONG;
    }

    @Override
    public String name() {
        return "PING";
    }
}
