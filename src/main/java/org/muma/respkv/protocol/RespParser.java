package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP 帧解析 (纯函数)
 * <p>
 * 只通过绝对下标 {@code getByte(i)} 读取 [readerIndex, writerIndex) 区间，
 * 不修改 ByteBuf 的任何索引。数据不够时返回 incomplete，调用方追加数据后
 * 从同一个前缀重新解析即可；解析成功后由调用方跳过 consumed 个字节。
 * <p>
 * 支持的子集：+ - $ *，数组元素只能是 Bulk String (命令请求只会用到这一种)。
 */
public final class RespParser {

    // RESP 协议常量
    public static final byte PLUS_BYTE = '+';
    public static final byte MINUS_BYTE = '-';
    public static final byte DOLLAR_BYTE = '$';
    public static final byte ASTERISK_BYTE = '*';

    // 回车换行
    public static final byte CR = '\r';
    public static final byte LF = '\n';

    private RespParser() {
    }

    public static RespParseResult parse(ByteBuf in) {
        int start = in.readerIndex();
        int end = in.writerIndex();
        if (start >= end) {
            return RespParseResult.incomplete();
        }

        byte typeByte = in.getByte(start);
        Node node = switch (typeByte) {
            case PLUS_BYTE -> parseSimpleString(in, start + 1, end);
            case MINUS_BYTE -> parseError(in, start + 1, end);
            case DOLLAR_BYTE -> parseBulkString(in, start + 1, end);
            case ASTERISK_BYTE -> parseArray(in, start + 1, end);
            default -> throw new RespProtocolException("unexpected type byte: " + describe(typeByte));
        };

        if (node == null) {
            return RespParseResult.incomplete();
        }
        return RespParseResult.complete(node.message, node.next - start);
    }

    // 解析出的值 + 紧随其后的下标
    private record Node(RedisMessage message, int next) {
    }

    // 行内容区间 [from, crlf)，下一行从 crlf + 2 开始
    private record Line(int from, int crlf) {
        int length() {
            return crlf - from;
        }

        int next() {
            return crlf + 2;
        }
    }

    private static Node parseSimpleString(ByteBuf in, int offset, int end) {
        Line line = readLine(in, offset, end);
        if (line == null) return null;
        return new Node(new SimpleString(lineAsString(in, line)), line.next());
    }

    private static Node parseError(ByteBuf in, int offset, int end) {
        Line line = readLine(in, offset, end);
        if (line == null) return null;
        return new Node(new ErrorMessage(lineAsString(in, line)), line.next());
    }

    // 解析 BulkString: $<length>\r\n<data>\r\n
    private static Node parseBulkString(ByteBuf in, int offset, int end) {
        Line line = readLine(in, offset, end);
        if (line == null) return null;

        long length = readLength(in, line, "bulk");
        if (length == -1) {
            return new Node(BulkString.nil(), line.next());
        }
        if (length < -1) {
            throw new RespProtocolException("invalid bulk length: " + length);
        }
        if (length > Integer.MAX_VALUE - 2) {
            // Java 数组放不下，按协议错误处理
            throw new RespProtocolException("bulk length out of range: " + length);
        }

        int dataStart = line.next();
        // long 运算，避免 length + 2 溢出
        if ((long) end - dataStart < length + 2) {
            return null;
        }

        int dataEnd = dataStart + (int) length;
        if (in.getByte(dataEnd) != CR || in.getByte(dataEnd + 1) != LF) {
            throw new RespProtocolException("expected CRLF after bulk payload");
        }

        byte[] content = new byte[(int) length];
        in.getBytes(dataStart, content);
        return new Node(new BulkString(content), dataEnd + 2);
    }

    // 解析 Array: *<count>\r\n<element1>...<elementN>
    private static Node parseArray(ByteBuf in, int offset, int end) {
        Line line = readLine(in, offset, end);
        if (line == null) return null;

        long count = readLength(in, line, "array");
        if (count == -1) {
            return new Node(RedisArray.nil(), line.next());
        }
        if (count < -1) {
            throw new RespProtocolException("invalid array length: " + count);
        }
        if (count > Integer.MAX_VALUE) {
            throw new RespProtocolException("array length out of range: " + count);
        }

        // 不按声明的 count 预分配，声明值由客户端控制
        List<RedisMessage> elements = new ArrayList<>();
        int cursor = line.next();
        for (long i = 0; i < count; i++) {
            if (cursor >= end) {
                return null;
            }
            byte type = in.getByte(cursor);
            if (type != DOLLAR_BYTE) {
                throw new RespProtocolException("only bulk strings supported in arrays, got type byte: " + describe(type));
            }
            Node element = parseBulkString(in, cursor + 1, end);
            if (element == null) {
                return null;
            }
            elements.add(element.message);
            cursor = element.next;
        }
        return new Node(new RedisArray(elements.toArray(new RedisMessage[0])), cursor);
    }

    // 辅助：查找下一个 \r\n，找不到说明这一行还没收全
    private static Line readLine(ByteBuf in, int offset, int end) {
        for (int i = offset; i < end - 1; i++) {
            if (in.getByte(i) == CR && in.getByte(i + 1) == LF) {
                return new Line(offset, i);
            }
        }
        return null;
    }

    private static String lineAsString(ByteBuf in, Line line) {
        return in.toString(line.from(), line.length(), StandardCharsets.UTF_8);
    }

    // 辅助：读取并解析长度行
    private static long readLength(ByteBuf in, Line line, String kind) {
        String s = in.toString(line.from(), line.length(), StandardCharsets.US_ASCII);
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new RespProtocolException("invalid " + kind + " length: '" + s + "'", e);
        }
    }

    private static String describe(byte b) {
        return b >= 0x20 && b < 0x7f ? "'" + (char) b + "'" : String.format("0x%02x", b & 0xff);
    }
}
