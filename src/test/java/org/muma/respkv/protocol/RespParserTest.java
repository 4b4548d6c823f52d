package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RespParserTest {

    private final List<ByteBuf> buffers = new ArrayList<>();

    @AfterEach
    void tearDown() {
        buffers.forEach(ByteBuf::release);
    }

    // --- 辅助方法 ---
    private ByteBuf buf(String s) {
        return buf(s.getBytes(StandardCharsets.UTF_8));
    }

    private ByteBuf buf(byte[] bytes) {
        ByteBuf b = Unpooled.buffer(bytes.length + 16);
        b.writeBytes(bytes);
        buffers.add(b);
        return b;
    }

    private RedisMessage parseComplete(String s) {
        ByteBuf in = buf(s);
        RespParseResult result = RespParser.parse(in);
        assertTrue(result.isComplete(), "expected complete frame for " + s);
        assertEquals(s.length(), result.consumed());
        return result.message();
    }

    @Test
    void testSimpleStringAndError() {
        assertEquals(new SimpleString("OK"), parseComplete("+OK\r\n"));
        assertEquals(new ErrorMessage("ERR boom"), parseComplete("-ERR boom\r\n"));
        assertEquals(new SimpleString(""), parseComplete("+\r\n"));
    }

    @Test
    void testLoneCarriageReturnStaysInStatusPayload() {
        assertEquals(new SimpleString("a\rb"), parseComplete("+a\rb\r\n"));
    }

    @Test
    void testBulkString() {
        assertEquals(new BulkString("hello"), parseComplete("$5\r\nhello\r\n"));
        assertEquals(new BulkString(new byte[0]), parseComplete("$0\r\n\r\n"));
        assertEquals(BulkString.nil(), parseComplete("$-1\r\n"));
    }

    @Test
    void testBulkStringMayContainCrlf() {
        RedisMessage msg = parseComplete("$4\r\na\r\nb\r\n");
        assertArrayEquals("a\r\nb".getBytes(StandardCharsets.UTF_8), ((BulkString) msg).content());
    }

    @Test
    void testArrayOfBulkStrings() {
        RedisMessage msg = parseComplete("*3\r\n$3\r\nSET\r\n$1\r\na\r\n$-1\r\n");
        RedisArray expected = new RedisArray(new RedisMessage[]{
                new BulkString("SET"), new BulkString("a"), BulkString.nil()
        });
        assertEquals(expected, msg);
    }

    @Test
    void testNullAndEmptyArrayAreDistinguished() {
        RedisMessage nil = parseComplete("*-1\r\n");
        RedisMessage empty = parseComplete("*0\r\n");
        assertTrue(((RedisArray) nil).isNull());
        assertFalse(((RedisArray) empty).isNull());
        assertEquals(0, ((RedisArray) empty).size());
        assertNotEquals(nil, empty);
    }

    @Test
    void testEmptyBufferIsIncomplete() {
        assertFalse(RespParser.parse(buf(new byte[0])).isComplete());
    }

    @Test
    void testOnlyFirstFrameIsConsumed() {
        ByteBuf in = buf("+PONG\r\n+OK\r\n");
        RespParseResult result = RespParser.parse(in);
        assertEquals(new SimpleString("PONG"), result.message());
        assertEquals(7, result.consumed());
        // 解析本身不移动 readerIndex
        assertEquals(0, in.readerIndex());

        in.skipBytes(result.consumed());
        assertEquals(new SimpleString("OK"), RespParser.parse(in).message());
    }

    @Test
    void testEverySplitPointIsIncompleteAndConsumesNothing() {
        String[] frames = {
                "+PONG\r\n",
                "-ERR unknown command 'FOOO'\r\n",
                "$5\r\nhello\r\n",
                "$0\r\n\r\n",
                "$-1\r\n",
                "*-1\r\n",
                "*0\r\n",
                "*3\r\n$3\r\nSET\r\n$3\r\nkey\r\n$5\r\nva\r\nl\r\n",
        };
        for (String frame : frames) {
            RedisMessage whole = parseComplete(frame);
            byte[] bytes = frame.getBytes(StandardCharsets.UTF_8);

            for (int split = 0; split < bytes.length; split++) {
                ByteBuf in = buf(new byte[0]);
                in.writeBytes(bytes, 0, split);

                RespParseResult partial = RespParser.parse(in);
                assertFalse(partial.isComplete(), "split " + split + " of " + frame);
                assertEquals(0, in.readerIndex());
                assertEquals(split, in.writerIndex());

                in.writeBytes(bytes, split, bytes.length - split);
                RespParseResult full = RespParser.parse(in);
                assertTrue(full.isComplete(), "split " + split + " of " + frame);
                assertEquals(whole, full.message());
                assertEquals(bytes.length, full.consumed());
            }
        }
    }

    @Test
    void testReaderIndexOffsetIsRespected() {
        ByteBuf in = buf("xx$2\r\nhi\r\n");
        in.skipBytes(2);
        RespParseResult result = RespParser.parse(in);
        assertEquals(new BulkString("hi"), result.message());
        assertEquals(8, result.consumed());
    }

    @Test
    void testUnknownTypeByteIsProtocolError() {
        RespProtocolException e = assertThrows(RespProtocolException.class, () -> RespParser.parse(buf(":1\r\n")));
        assertTrue(e.getMessage().contains("unexpected type byte"));
        assertThrows(RespProtocolException.class, () -> RespParser.parse(buf("PING\r\n")));
    }

    @Test
    void testInvalidLengthIsProtocolError() {
        assertThrows(RespProtocolException.class, () -> RespParser.parse(buf("$abc\r\n")));
        assertThrows(RespProtocolException.class, () -> RespParser.parse(buf("*x\r\n")));
        assertThrows(RespProtocolException.class, () -> RespParser.parse(buf("$\r\n")));
    }

    @Test
    void testNegativeLengthsBelowMinusOneAreProtocolErrors() {
        assertThrows(RespProtocolException.class, () -> RespParser.parse(buf("$-2\r\n")));
        assertThrows(RespProtocolException.class, () -> RespParser.parse(buf("*-5\r\n")));
    }

    @Test
    void testMissingCrlfAfterBulkPayloadIsProtocolError() {
        assertThrows(RespProtocolException.class, () -> RespParser.parse(buf("$3\r\nabcXY")));
    }

    @Test
    void testNonBulkInsideArrayIsProtocolError() {
        assertThrows(RespProtocolException.class, () -> RespParser.parse(buf("*1\r\n+OK\r\n")));
        assertThrows(RespProtocolException.class, () -> RespParser.parse(buf("*2\r\n$3\r\nGET\r\n*1\r\n$1\r\na\r\n")));
    }

    @Test
    void testLargeDeclaredBulkLengthWaitsForMoreData() {
        // 不限制声明长度：只是一直等待数据
        RespParseResult result = RespParser.parse(buf("$1000000000\r\nabc"));
        assertFalse(result.isComplete());
    }

    @Test
    void testLargeDeclaredArrayCountWaitsForMoreData() {
        RespParseResult result = RespParser.parse(buf("*2000000000\r\n$1\r\na\r\n"));
        assertFalse(result.isComplete());
    }

    @Test
    void testInvalidUtf8InStatusIsReplaced() {
        byte[] bytes = {'+', (byte) 0xff, 'o', 'k', '\r', '\n'};
        SimpleString s = (SimpleString) RespParser.parse(buf(bytes)).message();
        assertEquals("\uFFFDok", s.content());
    }
}
