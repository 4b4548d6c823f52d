package org.muma.respkv.protocol;

import java.util.Arrays;

// 4. 数组 (*) - 支持 null (表示 *-1)
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public static RedisArray nil() {
        return new RedisArray(null);
    }

    public boolean isNull() {
        return elements == null;
    }

    public int size() {
        return elements == null ? 0 : elements.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RedisArray other)) return false;
        return Arrays.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        return elements == null ? "RedisArray[nil]" : "RedisArray" + Arrays.toString(elements);
    }
}
