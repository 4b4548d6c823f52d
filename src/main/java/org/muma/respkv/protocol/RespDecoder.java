package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * RESP 协议解码器
 * <p>
 * ByteToMessageDecoder 的累积缓冲区就是每个连接自己的输入缓冲：
 * 每次 socket 读取的数据追加到尾部，完整帧从头部消费。
 * 半包时不消费任何字节，等下次读取后从同一位置重新解析。
 * 帧格式错误时抛出 {@link RespProtocolException}。
 */
public class RespDecoder extends ByteToMessageDecoder {

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        RespParseResult result;
        try {
            result = RespParser.parse(in);
        } catch (RespProtocolException e) {
            // 无法重新同步：丢弃剩余输入，由上层关闭连接
            in.skipBytes(in.readableBytes());
            throw e;
        }
        if (!result.isComplete()) {
            return;
        }
        in.skipBytes(result.consumed());
        out.add(result.message());
    }
}
