package org.muma.respkv.command;

import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.store.StorageEngine;

public record GetCommand(String key) implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage) {
        String value = storage.get(key);
        if (value == null) {
            return BulkString.nil(); // Nil
        }
        return new BulkString(value);
    }

    @Override
    public String name() {
        return "GET";
    }
}
