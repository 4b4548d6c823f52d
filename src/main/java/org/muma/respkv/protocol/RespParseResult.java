package org.muma.respkv.protocol;

/**
 * 一次解析的结果：要么数据不完整，要么得到一个完整帧以及它占用的字节数。
 * 协议错误通过 {@link RespProtocolException} 抛出。
 */
public final class RespParseResult {

    private static final RespParseResult INCOMPLETE = new RespParseResult(null, 0);

    private final RedisMessage message;
    private final int consumed;

    private RespParseResult(RedisMessage message, int consumed) {
        this.message = message;
        this.consumed = consumed;
    }

    public static RespParseResult incomplete() {
        return INCOMPLETE;
    }

    public static RespParseResult complete(RedisMessage message, int consumed) {
        return new RespParseResult(message, consumed);
    }

    public boolean isComplete() {
        return message != null;
    }

    public RedisMessage message() {
        return message;
    }

    public int consumed() {
        return consumed;
    }

    @Override
    public String toString() {
        return isComplete() ? "Complete{" + message + ", consumed=" + consumed + "}" : "Incomplete";
    }
}
