package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;
import org.muma.respkv.utils.RespCodecUtil;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RespWriterTest {

    private String encode(RedisMessage msg) {
        return new String(RespCodecUtil.encode(msg), StandardCharsets.UTF_8);
    }

    @Test
    void testEncodeScalars() {
        assertEquals("+PONG\r\n", encode(new SimpleString("PONG")));
        assertEquals("-ERR unknown command 'FOOO'\r\n", encode(new ErrorMessage("ERR unknown command 'FOOO'")));
        assertEquals("$1\r\n1\r\n", encode(new BulkString("1")));
        assertEquals("$0\r\n\r\n", encode(new BulkString(new byte[0])));
        assertEquals("$-1\r\n", encode(BulkString.nil()));
    }

    @Test
    void testEncodeArrays() {
        assertEquals("*-1\r\n", encode(RedisArray.nil()));
        assertEquals("*0\r\n", encode(new RedisArray(new RedisMessage[0])));
        assertEquals("*2\r\n$3\r\nGET\r\n$1\r\na\r\n", encode(RespCodecUtil.command("GET", "a")));
    }

    @Test
    void testEncodeNestedArraysRecursively() {
        RedisArray nested = new RedisArray(new RedisMessage[]{
                new SimpleString("OK"),
                new RedisArray(new RedisMessage[]{new BulkString("x"), BulkString.nil()}),
                new ErrorMessage("ERR e"),
                RedisArray.nil()
        });
        assertEquals("*4\r\n+OK\r\n*2\r\n$1\r\nx\r\n$-1\r\n-ERR e\r\n*-1\r\n", encode(nested));
    }

    @Test
    void testLineTerminatorsInStatusAndErrorAreReplaced() {
        assertEquals("+a b\r\n", encode(new SimpleString("a\nb")));
        assertEquals("-ERR x  +INJ\r\n", encode(new ErrorMessage("ERR x\r\n+INJ")));
        // Bulk String 按长度编码，内容不受影响
        assertEquals("$4\r\na\r\nb\r\n", encode(new BulkString("a\r\nb")));
    }

    @Test
    void testBulkLengthCountsBytesNotChars() {
        // "é" 在 UTF-8 下是 2 个字节
        assertEquals("$2\r\né\r\n", encode(new BulkString("é")));
    }

    @Test
    void testRoundTrip() {
        RedisMessage[] values = {
                new SimpleString("OK"),
                new ErrorMessage("ERR wrong number of arguments for 'GET'"),
                new BulkString("value with \r\n inside"),
                new BulkString(new byte[]{0, (byte) 0xff, '\r', '\n', 7}),
                new BulkString(new byte[0]),
                BulkString.nil(),
                RedisArray.nil(),
                new RedisArray(new RedisMessage[0]),
                new RedisArray(new RedisMessage[]{new BulkString("SET"), BulkString.nil(), new BulkString("")}),
        };
        for (RedisMessage value : values) {
            ByteBuf buf = Unpooled.wrappedBuffer(RespCodecUtil.encode(value));
            try {
                RespParseResult result = RespParser.parse(buf);
                assertTrue(result.isComplete());
                assertEquals(value, result.message());
                assertEquals(buf.readableBytes(), result.consumed());
            } finally {
                buf.release();
            }
        }
    }
}
