package org.muma.respkv.utils;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.RespWriter;

/**
 * RESP 协议编码工具类
 * 用于不在 Netty Pipeline 上的场景 (日志、客户端、测试) 把消息转成字节数组
 */
public class RespCodecUtil {

    private RespCodecUtil() {
    }

    public static byte[] encode(RedisMessage msg) {
        ByteBuf buf = Unpooled.buffer(64);
        try {
            RespWriter.write(buf, msg);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    /**
     * 把命令参数打包成 Bulk String 数组，即客户端发送请求的格式
     */
    public static RedisArray command(String... args) {
        RedisMessage[] elements = new RedisMessage[args.length];
        for (int i = 0; i < args.length; i++) {
            elements[i] = new BulkString(args[i]);
        }
        return new RedisArray(elements);
    }
}
