package org.muma.respkv.command;

import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;
import org.muma.respkv.store.StorageEngine;

public record SetCommand(String key, String value) implements RedisCommand {

    private static final SimpleString OK = new SimpleString("OK");

    @Override
    public RedisMessage execute(StorageEngine storage) {
        storage.put(key, value);
        return OK;
    }

    @Override
    public String name() {
        return "SET";
    }

    @Override
    public boolean isWrite() {
        return true;
    }
}
