package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;

/**
 * RESP 编码：把一个 RedisMessage 写成线上字节。
 * 编码逻辑集中在这里，数组元素递归调用同一个 write 方法。
 */
public final class RespWriter {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NIL_LENGTH = "-1".getBytes(StandardCharsets.UTF_8);

    private RespWriter() {
    }

    public static void write(ByteBuf out, RedisMessage msg) {
        if (msg instanceof SimpleString s) {
            out.writeByte(RespParser.PLUS_BYTE);
            writeLine(out, msg.toBytes(s.content()));
        } else if (msg instanceof ErrorMessage e) {
            out.writeByte(RespParser.MINUS_BYTE);
            writeLine(out, msg.toBytes(e.content()));
        } else if (msg instanceof BulkString b) {
            out.writeByte(RespParser.DOLLAR_BYTE);
            if (b.content() == null) {
                out.writeBytes(NIL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeLength(out, b.content().length);
                out.writeBytes(b.content());
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            out.writeByte(RespParser.ASTERISK_BYTE);
            if (a.elements() == null) {
                out.writeBytes(NIL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeLength(out, a.elements().length);
                for (RedisMessage element : a.elements()) {
                    write(out, element);
                }
            }
        }
    }

    // 单行内容里的 CR/LF 写成空格，一个消息只能占一行
    private static void writeLine(ByteBuf out, byte[] content) {
        for (byte b : content) {
            out.writeByte(b == RespParser.CR || b == RespParser.LF ? ' ' : b);
        }
        out.writeBytes(CRLF);
    }

    private static void writeLength(ByteBuf out, int length) {
        out.writeBytes(String.valueOf(length).getBytes(StandardCharsets.US_ASCII));
        out.writeBytes(CRLF);
    }
}
